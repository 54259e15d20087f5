package com.cellar.readiness.init;

import com.cellar.readiness.config.BackfillProperties;
import com.cellar.readiness.entity.BackfillLock;
import com.cellar.readiness.repository.BackfillLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure the backfill lock row exists; the lock is only ever taken by updating it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackfillLockInitializer implements CommandLineRunner {

    private final BackfillLockRepository lockRepository;
    private final BackfillProperties properties;

    @Override
    public void run(String... args) {
        String name = properties.getLockName();
        if (lockRepository.existsById(name)) {
            return;
        }
        lockRepository.save(BackfillLock.builder().name(name).locked(false).build());
        log.info("Created backfill lock row '{}'", name);
    }
}
