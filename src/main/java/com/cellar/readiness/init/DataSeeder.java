package com.cellar.readiness.init;

import com.cellar.readiness.entity.BottleEntity;
import com.cellar.readiness.entity.WineEntity;
import com.cellar.readiness.repository.BottleRepository;
import com.cellar.readiness.repository.WineRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds a small cellar to try readiness, backfill and lineups against.
 * Only runs in 'dev' profile
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DataSeeder implements CommandLineRunner {

    private final WineRepository wineRepository;
    private final BottleRepository bottleRepository;

    @Override
    public void run(String... args) {
        if (wineRepository.count() > 0) {
            log.info("Database already has data, skipping seeding");
            return;
        }

        log.info("Seeding sample cellar...");

        List<WineEntity> wines = List.of(
            WineEntity.builder()
                .wineName("Barolo Cannubi")
                .producer("Brezza")
                .vintage(2015)
                .color("red")
                .grapes(List.of("Nebbiolo"))
                .region("Piedmont")
                .appellation("Barolo")
                .country("Italy")
                .rating(4.3)
                .build(),

            WineEntity.builder()
                .wineName("Barolo Cannubi")
                .producer("Brezza")
                .vintage(2019)
                .color("red")
                .grapes(List.of("Nebbiolo"))
                .region("Piedmont")
                .appellation("Barolo")
                .country("Italy")
                .rating(4.2)
                .build(),

            WineEntity.builder()
                .wineName("Bourgogne Rouge")
                .producer("Domaine Roulot")
                .vintage(2020)
                .color("red")
                .grapes(List.of("Pinot Noir"))
                .region("Burgundy")
                .country("France")
                .rating(3.9)
                .build(),

            WineEntity.builder()
                .wineName("Chablis Premier Cru")
                .producer("William Fevre")
                .vintage(2021)
                .color("white")
                .grapes(List.of("Chardonnay"))
                .region("Burgundy")
                .appellation("Chablis")
                .country("France")
                .rating(4.0)
                .build(),

            WineEntity.builder()
                .wineName("Brut Reserve")
                .producer("Charles Heidsieck")
                .vintage(2022)
                .color("sparkling")
                .grapes(List.of("Chardonnay", "Pinot Noir", "Pinot Meunier"))
                .region("Champagne")
                .country("France")
                .rating(4.4)
                .build(),

            WineEntity.builder()
                .wineName("Cotes de Provence")
                .producer("Domaine Ott")
                .vintage(2023)
                .color("rose")
                .grapes(List.of("Grenache", "Cinsault"))
                .region("Provence")
                .country("France")
                .rating(3.7)
                .build(),

            WineEntity.builder()
                .wineName("Hermitage")
                .producer("Jaboulet")
                .vintage(2012)
                .color("red")
                .grapes(List.of("Syrah"))
                .region("Northern Rhone")
                .appellation("Hermitage")
                .country("France")
                .rating(4.5)
                .build()
        );

        List<WineEntity> saved = wineRepository.saveAll(wines);
        for (WineEntity wine : saved) {
            bottleRepository.save(BottleEntity.builder().wine(wine).quantity(2).build());
        }
        log.info("Seeded {} wines with bottles", saved.size());
    }
}
