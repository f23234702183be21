package com.meetpoll.storage;

import com.meetpoll.exception.ConflictException;
import com.meetpoll.exception.ContactInUseException;
import com.meetpoll.exception.IntegrityViolationException;
import com.meetpoll.exception.SchedulerException;
import com.meetpoll.exception.StorageFailureException;
import com.meetpoll.exception.TransientStorageException;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.util.Locale;
import java.util.Map;

/**
 * Maps Spring data-access failures onto the scheduler error taxonomy so that no raw storage
 * exception crosses a service boundary.
 */
@Component
public class StorageErrorTranslator {

    private static final Map<String, String> UNIQUE_MESSAGES = Map.of(
            "uk_organizers_email", "An organizer with this email already exists",
            "uk_contacts_owner_email", "A contact with this email already exists",
            "uk_group_members", "The contact is already a member of this group",
            "uk_group_shares", "The group is already shared with this organizer",
            "uk_participants_meeting_contact", "The contact is already a participant of this meeting",
            "uk_participants_token", "Access token collision",
            "uk_slot_responses", "A response for this slot already exists",
            "uk_suggested_slots", "A suggestion from this participant already exists"
    );

    public SchedulerException translate(RuntimeException exception) {
        if (exception instanceof SchedulerException schedulerException) {
            return schedulerException;
        }
        if (exception instanceof DataIntegrityViolationException integrity) {
            return translateIntegrity(integrity);
        }
        if (exception instanceof TransientDataAccessException
                || exception instanceof DataAccessResourceFailureException
                || exception instanceof TransactionTimedOutException
                || exception instanceof CannotCreateTransactionException) {
            return new TransientStorageException(exception, "Storage is temporarily unavailable, please retry");
        }
        if (exception instanceof DataAccessException || exception instanceof TransactionException) {
            return new StorageFailureException(exception, "Storage operation failed");
        }
        return new StorageFailureException(exception, "Unexpected storage error");
    }

    SchedulerException translateIntegrity(DataIntegrityViolationException exception) {
        String constraint = constraintName(exception);
        if (constraint != null) {
            for (Map.Entry<String, String> entry : UNIQUE_MESSAGES.entrySet()) {
                if (constraint.contains(entry.getKey())) {
                    return new ConflictException(exception, entry.getValue());
                }
            }
            if (constraint.contains("fk_participants_contact") || constraint.contains("fk_slot_responses_contact")
                    || constraint.contains("fk_suggested_slots_contact")) {
                return new ContactInUseException(exception);
            }
        }
        return new IntegrityViolationException(exception, "Data integrity constraint violated");
    }

    static String constraintName(Throwable exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof ConstraintViolationException violation && violation.getConstraintName() != null) {
                return violation.getConstraintName().toLowerCase(Locale.ROOT);
            }
            current = current.getCause();
        }
        String message = exception.getMessage();
        return message == null ? null : message.toLowerCase(Locale.ROOT);
    }
}
