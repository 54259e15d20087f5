package com.cellar.readiness.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * One wine row a backfill batch could not process.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackfillFailure implements Serializable {
    private Long rowId;
    private String error;
}
