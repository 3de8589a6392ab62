package com.cred.freestyle.marketplace.infrastructure.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Defers side effects (Kafka publishes, cache eviction) until the surrounding
 * database transaction has committed. A rolled-back transaction runs nothing.
 *
 * Outside a transaction the action runs immediately.
 *
 * @author Marketplace Team
 */
public final class AfterCommit {

    private static final Logger logger = LoggerFactory.getLogger(AfterCommit.class);

    private AfterCommit() {
    }

    /**
     * Run the action once the current transaction commits.
     *
     * @param description Short description used in logs
     * @param action Side effect to run
     */
    public static void run(String description, Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    // The transaction is already committed; the side effect cannot undo it
                    logger.error("After-commit action '{}' failed", description, e);
                }
            }

            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_ROLLED_BACK) {
                    logger.debug("Skipped after-commit action '{}': transaction rolled back", description);
                }
            }
        });
    }
}
