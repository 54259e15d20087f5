package com.cellar.readiness.dto;

import com.cellar.readiness.domain.ReadinessStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two vintages of the same wine whose readiness runs backwards:
 * the older one still needs time while the younger one is already drinkable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VintageInversion {
    private String wineName;
    private String producer;

    private Long olderWineId;
    private Integer olderVintage;
    private ReadinessStatus olderStatus;

    private Long youngerWineId;
    private Integer youngerVintage;
    private ReadinessStatus youngerStatus;

    private String issue;
}
