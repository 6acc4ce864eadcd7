package com.example.dutyroster.roster;

import com.example.dutyroster.config.RosterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class RosterService {

    private static final Logger logger = LoggerFactory.getLogger(RosterService.class);

    private final RosterSettings settings;
    private final Executor trialExecutor;

    public RosterService(RosterSettings settings, @Qualifier("rosterTrialExecutor") Executor trialExecutor) {
        this.settings = settings;
        this.trialExecutor = trialExecutor;
    }

    /**
     * Runs independent trials with seeds {@code seed, seed+1, ...} and keeps the one with the
     * fewest findings; the earliest seed wins a tie. Input errors are thrown before any trial starts.
     */
    public RosterResult generate(RosterInput input, Long seed) {
        RosterEngine engine = new RosterEngine(settings.toPolicy());
        RosterConfiguration configuration = engine.check(input);
        logger.info("Generating roster: {} primary, {} secondary, {}", input.primary().size(),
                input.secondary().size(), configuration);

        long baseSeed = seed != null ? seed : ThreadLocalRandom.current().nextLong();
        int trials = settings.getTrials();
        List<CompletableFuture<RosterResult>> futures = new ArrayList<>(trials);
        for (int i = 0; i < trials; i++) {
            long trialSeed = baseSeed + i;
            futures.add(CompletableFuture.supplyAsync(() -> engine.generate(input, trialSeed), trialExecutor));
        }

        List<RosterResult> results = new ArrayList<>(trials);
        try {
            for (CompletableFuture<RosterResult> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        RosterResult best = results.stream()
                .min(Comparator.comparingInt(r -> r.violations().size()))
                .orElseThrow();
        if (best.isClean()) {
            logger.info("Picked seed {} out of {} trials with no findings", best.seed(), trials);
        } else {
            logger.warn("Best of {} trials (seed {}) still has {} findings: {}", trials, best.seed(),
                    best.violations().size(), best.violations());
        }
        return best;
    }
}
