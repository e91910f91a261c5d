package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.exception.ProviderUnavailableException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Un lock por usuario. Serializa el refresh y las escrituras de credenciales de un mismo
 * usuario; usuarios distintos nunca se bloquean entre sí. Los locks son reentrantes, así el
 * refresh puede llamar al store sin bloquearse a sí mismo.
 *
 * <p>Cada entrada cuenta los hilos que la usan y se quita del mapa cuando el último sale.
 */
@Component
public class UserLockRegistry {

    private final ConcurrentMap<Long, Entry> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public UserLockRegistry(GoogleCalendarProperties props) {
        this.timeout = props.getRefreshLockTimeout();
    }

    public <T> T withLock(long userId, Supplier<T> action) {
        Entry entry = locks.compute(userId, (id, current) -> {
            Entry e = current != null ? current : new Entry();
            e.users++;
            return e;
        });
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProviderUnavailableException("Interrumpido esperando la credencial del usuario " + userId, e);
            }
            if (!acquired) {
                throw new ProviderUnavailableException("Otra operación sobre la credencial del usuario " + userId + " sigue en curso");
            }
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            locks.computeIfPresent(userId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    // visible para tests
    int trackedUsers() {
        return locks.size();
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        // solo se modifica dentro de compute sobre la misma clave
        int users;
    }
}
