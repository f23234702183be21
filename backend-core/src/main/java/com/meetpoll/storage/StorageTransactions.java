package com.meetpoll.storage;

import com.meetpoll.config.MeetPollProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs each unit of work in its own short transaction. Read-modify-write sequences go through
 * {@link #writeWithRetry(Supplier)}: the unique constraints in the schema decide races, and the
 * losing request simply runs its work again against the committed state.
 */
@Slf4j
@Component
public class StorageTransactions {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;
    private final StorageErrorTranslator translator;
    private final int maxAttempts;

    public StorageTransactions(PlatformTransactionManager transactionManager,
                               MeetPollProperties properties,
                               StorageErrorTranslator translator) {
        int timeoutSeconds = (int) Math.max(1, properties.safeStorageTimeout().toSeconds());
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(timeoutSeconds);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setTimeout(timeoutSeconds);
        this.readTemplate.setReadOnly(true);
        this.translator = translator;
        this.maxAttempts = properties.safeMaxAttempts();
    }

    public <T> T read(Supplier<T> work) {
        try {
            return readTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            throw translator.translate(e);
        }
    }

    public <T> T write(Supplier<T> work) {
        try {
            return writeTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            throw translator.translate(e);
        }
    }

    public void run(Runnable work) {
        write(() -> {
            work.run();
            return null;
        });
    }

    public <T> T writeWithRetry(Supplier<T> work) {
        DataIntegrityViolationException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return writeTemplate.execute(status -> work.get());
            } catch (DataIntegrityViolationException e) {
                last = e;
                log.debug("Constraint violation on attempt {}/{}, retrying: {}", attempt, maxAttempts, e.getMessage());
            } catch (RuntimeException e) {
                throw translator.translate(e);
            }
        }
        throw translator.translate(last);
    }
}
