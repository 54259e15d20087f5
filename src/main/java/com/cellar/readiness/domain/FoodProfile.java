package com.cellar.readiness.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Description of a dish. Any field may be null; null and NONE are neutral.
 */
@Value
@Builder
@Jacksonized
public class FoodProfile {

    Protein protein;
    Sauce sauce;
    Level spiceLevel;
    Level smokeLevel;

    public static FoodProfile neutral() {
        return FoodProfile.builder().build();
    }

    public enum Protein {
        BEEF, LAMB, PORK, POULTRY, FISH, VEGETARIAN, NONE;

        public boolean isRichMeat() {
            return this == BEEF || this == LAMB || this == PORK;
        }
    }

    public enum Sauce {
        NONE, TOMATO, CREAM, BBQ, RICH
    }

    public enum Level {
        LOW, MED, HIGH;

        public boolean atLeast(Level other) {
            return ordinal() >= other.ordinal();
        }
    }
}
