package com.cellar.readiness.engine;

import java.util.List;

/**
 * Default grape and region lookup tables for the heuristic estimator.
 * Keywords are lower case and accent free. More specific keywords come first.
 */
public final class HeuristicProfileTables {

    private HeuristicProfileTables() {
    }

    public static final List<GrapeProfileRule> GRAPES = List.of(
            // Reds
            GrapeProfileRule.builder().keyword("nebbiolo")
                    .body(4).tannin(5).acidity(5).oak(3).sweetness(0)
                    .agingNote("Nebbiolo: tannic, high-acid grape built for long aging").build(),
            GrapeProfileRule.builder().keyword("cabernet franc")
                    .body(3).tannin(3).acidity(4).oak(2).sweetness(0)
                    .agingNote("Cabernet Franc: medium structure, ages moderately").build(),
            GrapeProfileRule.builder().keyword("cabernet")
                    .body(4).tannin(4).acidity(4).oak(4).sweetness(0)
                    .agingNote("Cabernet Sauvignon: firm tannin, classic long-aging grape").build(),
            GrapeProfileRule.builder().keyword("syrah").keyword("shiraz")
                    .body(5).tannin(4).acidity(3).oak(3).sweetness(0)
                    .agingNote("Syrah: full and tannic, rewards cellaring").build(),
            GrapeProfileRule.builder().keyword("sangiovese").keyword("brunello")
                    .body(3).tannin(4).acidity(4).oak(3).sweetness(0)
                    .agingNote("Sangiovese: high acid and firm tannin, ages well").build(),
            GrapeProfileRule.builder().keyword("tempranillo").keyword("tinta roriz")
                    .body(4).tannin(3).acidity(3).oak(4).sweetness(0)
                    .agingNote("Tempranillo: oak-friendly, mid to long aging").build(),
            GrapeProfileRule.builder().keyword("mourvedre").keyword("monastrell")
                    .body(4).tannin(4).acidity(3).oak(2).sweetness(0)
                    .agingNote("Mourvedre: dense and tannic, needs time").build(),
            GrapeProfileRule.builder().keyword("malbec")
                    .body(4).tannin(3).acidity(3).oak(3).sweetness(0)
                    .agingNote("Malbec: generous fruit, drinks well in mid-life").build(),
            GrapeProfileRule.builder().keyword("merlot")
                    .body(3).tannin(3).acidity(3).oak(3).sweetness(0)
                    .agingNote("Merlot: supple tannin, approachable early").build(),
            GrapeProfileRule.builder().keyword("zinfandel").keyword("primitivo")
                    .body(5).tannin(3).acidity(2).oak(3).sweetness(1)
                    .agingNote("Zinfandel: ripe and bold, best in its first decade").build(),
            GrapeProfileRule.builder().keyword("grenache").keyword("garnacha")
                    .body(4).tannin(2).acidity(2).oak(2).sweetness(0)
                    .agingNote("Grenache: soft tannin, drinks early").build(),
            GrapeProfileRule.builder().keyword("pinot noir").keyword("spatburgunder")
                    .body(2).tannin(2).acidity(4).oak(2).sweetness(0)
                    .agingNote("Pinot Noir: light tannin, usually enjoyed in its youth").build(),
            GrapeProfileRule.builder().keyword("gamay")
                    .body(2).tannin(1).acidity(4).oak(1).sweetness(0)
                    .agingNote("Gamay: light and fruity, made to drink young").build(),
            // Whites
            GrapeProfileRule.builder().keyword("chardonnay")
                    .body(3).tannin(1).acidity(3).oak(3).sweetness(0)
                    .agingNote("Chardonnay: versatile, oaked styles hold longer").build(),
            GrapeProfileRule.builder().keyword("sauvignon blanc")
                    .body(2).tannin(1).acidity(5).oak(1).sweetness(0)
                    .agingNote("Sauvignon Blanc: crisp, best fresh").build(),
            GrapeProfileRule.builder().keyword("riesling")
                    .body(2).tannin(1).acidity(5).oak(1).sweetness(2)
                    .agingNote("Riesling: high acidity lets it age gracefully").build(),
            GrapeProfileRule.builder().keyword("chenin")
                    .body(3).tannin(1).acidity(5).oak(1).sweetness(1)
                    .agingNote("Chenin Blanc: acid backbone, can age").build(),
            GrapeProfileRule.builder().keyword("viognier")
                    .body(4).tannin(1).acidity(2).oak(2).sweetness(0)
                    .agingNote("Viognier: rich and aromatic, drink young").build(),
            GrapeProfileRule.builder().keyword("pinot grigio").keyword("pinot gris")
                    .body(2).tannin(1).acidity(3).oak(1).sweetness(0)
                    .agingNote("Pinot Grigio: light, drink young").build()
    );

    public static final List<RegionAdjustment> REGIONS = List.of(
            RegionAdjustment.builder().keyword("bordeaux").keyword("napa")
                    .bodyDelta(1).tanninDelta(1).oakDelta(1).build(),
            RegionAdjustment.builder().keyword("burgundy").keyword("bourgogne").keyword("willamette")
                    .bodyDelta(-1).acidityDelta(1).oakDelta(1).build(),
            RegionAdjustment.builder().keyword("barolo").keyword("barbaresco").keyword("brunello")
                    .keyword("rioja").keyword("ribera")
                    .tanninDelta(1).oakDelta(1).build(),
            RegionAdjustment.builder().keyword("rhone").keyword("barossa").keyword("priorat")
                    .bodyDelta(1).oakDelta(-1).build(),
            RegionAdjustment.builder().keyword("champagne").keyword("mosel").keyword("loire")
                    .acidityDelta(1).build(),
            RegionAdjustment.builder().keyword("beaujolais")
                    .bodyDelta(-1).tanninDelta(-1).build()
    );
}
