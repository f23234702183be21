package com.meetpoll.storage;

import com.meetpoll.config.MeetPollProperties;
import com.meetpoll.exception.ConflictException;
import com.meetpoll.exception.InvalidArgumentException;
import com.meetpoll.exception.TransientStorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StorageTransactionsTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    private StorageTransactions storage;

    @BeforeEach
    void setUp() {
        MeetPollProperties properties = new MeetPollProperties(null, null, null,
                new MeetPollProperties.Storage(Duration.ofSeconds(3), 3), null, null);
        storage = new StorageTransactions(transactionManager, properties, new StorageErrorTranslator());
    }

    @Test
    void writeWithRetry_shouldRerunWorkAfterConstraintViolation() {
        AtomicInteger calls = new AtomicInteger();

        String result = storage.writeWithRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new DataIntegrityViolationException("uk_participants_meeting_contact");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, calls.get());
        verify(transactionManager, times(3)).getTransaction(any());
    }

    @Test
    void writeWithRetry_shouldTranslateLastViolationWhenAttemptsRunOut() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ConflictException.class, () -> storage.writeWithRetry(() -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("uk_group_members");
        }));
        assertEquals(3, calls.get());
    }

    @Test
    void writeWithRetry_shouldNotRetryDomainErrors() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(InvalidArgumentException.class, () -> storage.writeWithRetry(() -> {
            calls.incrementAndGet();
            throw new InvalidArgumentException("bad input");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void write_shouldTranslateDataAccessFailures() {
        assertThrows(TransientStorageException.class, () -> storage.write(() -> {
            throw new QueryTimeoutException("statement timeout");
        }));
    }

    @Test
    void read_shouldUseReadOnlyTransactionWithTimeout() {
        storage.read(() -> 1);

        verify(transactionManager).getTransaction(argThat((TransactionDefinition definition) ->
                definition.isReadOnly() && definition.getTimeout() == 3));
    }
}
