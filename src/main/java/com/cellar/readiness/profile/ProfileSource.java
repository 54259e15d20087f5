package com.cellar.readiness.profile;

import com.cellar.readiness.domain.StructuralProfile;

import java.util.Optional;

/**
 * Where structural profiles come from. Empty means "no profile", and callers fall back
 * to the heuristic estimate.
 */
public interface ProfileSource {

    Optional<StructuralProfile> getProfile(long wineId);
}
