package com.cityhive.service.infrastructure.persistence;

import com.cityhive.service.domain.creation.IntegrityViolationException;
import com.cityhive.service.domain.creation.PersistenceException;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Narrows Spring's {@link DataAccessException} hierarchy to the two exceptions the domain
 * understands. Messages name the operation only; driver text stays in the cause.
 */
final class DataAccessTranslator {

    private DataAccessTranslator() {
    }

    static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityViolationException(operation + " violated a constraint", e);
        } catch (DataAccessException e) {
            throw new PersistenceException(operation + " failed", e);
        }
    }
}
