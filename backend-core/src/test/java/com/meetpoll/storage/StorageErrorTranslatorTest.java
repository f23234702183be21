package com.meetpoll.storage;

import com.meetpoll.exception.ConflictException;
import com.meetpoll.exception.ContactInUseException;
import com.meetpoll.exception.ErrorKind;
import com.meetpoll.exception.NotFoundException;
import com.meetpoll.exception.SchedulerException;
import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.InvalidDataAccessResourceUsageException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageErrorTranslatorTest {

    private final StorageErrorTranslator translator = new StorageErrorTranslator();

    @Test
    void translate_shouldPassSchedulerExceptionsThrough() {
        NotFoundException notFound = new NotFoundException("Meeting %s not found", "m1");

        assertSame(notFound, translator.translate(notFound));
    }

    @Test
    void translate_shouldMapNamedUniqueConstraintToConflict() {
        ConstraintViolationException cause = new ConstraintViolationException(
                "duplicate key", new SQLException("duplicate key"), "UK_CONTACTS_OWNER_EMAIL");

        SchedulerException translated = translator.translate(new DataIntegrityViolationException("could not execute", cause));

        assertInstanceOf(ConflictException.class, translated);
        assertEquals("A contact with this email already exists", translated.getMessage());
    }

    @Test
    void translate_shouldMapContactForeignKeyToContactInUse() {
        SchedulerException translated = translator.translate(new DataIntegrityViolationException(
                "update or delete on table \"contacts\" violates foreign key constraint \"fk_participants_contact\""));

        assertInstanceOf(ContactInUseException.class, translated);
    }

    @Test
    void translate_shouldMapUnknownIntegrityViolationToConstraintViolation() {
        SchedulerException translated = translator.translate(new DataIntegrityViolationException("check constraint failed"));

        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, translated.getKind());
    }

    @Test
    void translate_shouldMarkConnectivityProblemsRetryable() {
        assertTrue(translator.translate(new QueryTimeoutException("timeout")).isRetryable());
        assertTrue(translator.translate(new CannotCreateTransactionException("no connection")).isRetryable());
    }

    @Test
    void translate_shouldMapOtherFailuresToInternal() {
        assertEquals(ErrorKind.INTERNAL,
                translator.translate(new InvalidDataAccessResourceUsageException("bad grammar")).getKind());
        assertEquals(ErrorKind.INTERNAL, translator.translate(new IllegalStateException("boom")).getKind());
    }
}
