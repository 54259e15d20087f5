package com.cellar.readiness.engine;

import com.cellar.readiness.domain.FoodProfile;
import com.cellar.readiness.domain.FoodProfile.Level;
import com.cellar.readiness.domain.FoodProfile.Protein;
import com.cellar.readiness.domain.FoodProfile.Sauce;
import com.cellar.readiness.domain.StructuralProfile;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Default pairing rule set, evaluated in this order.
 */
public final class PairingRules {

    private PairingRules() {
    }

    public static List<PairingRule> defaults() {
        return List.of(
                new FatRichnessRule(),
                new AcidMatchRule(),
                new SpiceRule(),
                new SmokeCharRule(),
                new SeafoodRule(),
                new LightProteinRule()
        );
    }

    private static Optional<PairingContribution> contribution(String rule, int weight,
                                                             String positive, String negative) {
        if (weight == 0) {
            return Optional.empty();
        }
        return Optional.of(new PairingContribution(rule, weight, weight > 0 ? positive : negative));
    }

    /**
     * Rich sauces and red meats want tannin to bind protein and acidity to cut fat.
     */
    static final class FatRichnessRule implements PairingRule {

        @Override
        public String name() {
            return "fat-richness";
        }

        @Override
        public Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food) {
            Protein protein = food.getProtein();
            Sauce sauce = food.getSauce();
            boolean richMeat = protein != null && protein.isRichMeat();
            boolean richSauce = sauce == Sauce.RICH || sauce == Sauce.CREAM;
            if (!richMeat && !richSauce) {
                return Optional.empty();
            }

            int structure = wine.getTannin() + wine.getAcidity();
            int weight;
            if (structure >= 8) {
                weight = 30;
            } else if (structure >= 6) {
                weight = 18;
            } else if (structure >= 4) {
                weight = 0;
            } else {
                weight = -20;
            }
            if (richMeat && wine.getBody() >= 4) {
                weight += 5;
            }

            String positive = richMeat && wine.getTannin() >= 4
                    ? String.format("Firm tannin binds the %s protein and acidity cuts the fat",
                    protein.name().toLowerCase(Locale.ROOT))
                    : "Fresh acidity cuts through the richness";
            return contribution(name(), weight, positive, "Too soft in tannin and acidity for a rich dish");
        }
    }

    /**
     * Tomato is acidic; the wine needs at least as much.
     */
    static final class AcidMatchRule implements PairingRule {

        @Override
        public String name() {
            return "acid-match";
        }

        @Override
        public Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food) {
            if (food.getSauce() != Sauce.TOMATO) {
                return Optional.empty();
            }
            int weight;
            if (wine.getAcidity() >= 4) {
                weight = 20;
            } else if (wine.getAcidity() == 3) {
                weight = 5;
            } else {
                weight = -15;
            }
            return contribution(name(), weight,
                    "Bright acidity matches the tomato",
                    "Low acidity tastes flat against tomato");
        }
    }

    /**
     * Heat is amplified by tannin and alcohol (approximated by power) and soothed by sweetness.
     */
    static final class SpiceRule implements PairingRule {

        @Override
        public String name() {
            return "spice";
        }

        @Override
        public Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food) {
            if (food.getSpiceLevel() != Level.HIGH) {
                return Optional.empty();
            }
            int weight = 0;
            if (wine.getTannin() >= 4) {
                weight -= 10;
            }
            if (wine.getPower() >= 7) {
                weight -= 10;
            }
            if (wine.getSweetness() > 0) {
                weight += 15;
            }
            return contribution(name(), weight,
                    "A touch of sweetness tames the heat",
                    "Firm tannin and high alcohol amplify the heat");
        }
    }

    static final class SmokeCharRule implements PairingRule {

        @Override
        public String name() {
            return "smoke-char";
        }

        @Override
        public Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food) {
            Level smoke = food.getSmokeLevel();
            boolean smoky = (smoke != null && smoke.atLeast(Level.MED)) || food.getSauce() == Sauce.BBQ;
            if (!smoky) {
                return Optional.empty();
            }
            int weight = 0;
            if (wine.getOak() >= 3) {
                weight += 12;
            }
            if (wine.getBody() >= 4) {
                weight += 8;
            }
            if (wine.getOak() <= 1) {
                weight -= 8;
            }
            return contribution(name(), weight,
                    "Oak and body echo the smoke and char",
                    "Unoaked and light, lost against smoky flavors");
        }
    }

    static final class SeafoodRule implements PairingRule {

        @Override
        public String name() {
            return "seafood";
        }

        @Override
        public Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food) {
            if (food.getProtein() != Protein.FISH) {
                return Optional.empty();
            }
            int weight = 0;
            if (wine.getBody() <= 2) {
                weight += 10;
            }
            if (wine.getAcidity() >= 4) {
                weight += 10;
            }
            if (wine.getTannin() >= 3) {
                weight -= 20;
            }
            return contribution(name(), weight,
                    "Crisp and light alongside fish",
                    "Tannin clashes with fish");
        }
    }

    static final class LightProteinRule implements PairingRule {

        @Override
        public String name() {
            return "light-protein";
        }

        @Override
        public Optional<PairingContribution> evaluate(StructuralProfile wine, FoodProfile food) {
            Protein protein = food.getProtein();
            if (protein != Protein.POULTRY && protein != Protein.VEGETARIAN) {
                return Optional.empty();
            }
            int weight = 0;
            if (wine.getBody() >= 2 && wine.getBody() <= 4) {
                weight += 8;
            }
            if (wine.getAcidity() >= 3) {
                weight += 5;
            }
            if (wine.getBody() >= 5 && wine.getTannin() >= 5) {
                weight -= 15;
            }
            return contribution(name(), weight,
                    "Medium weight suits a lighter dish",
                    "Overpowers a delicate dish");
        }
    }
}
