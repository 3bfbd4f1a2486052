package za.ac.salt.saltuser.utils;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * A value which is computed on first access and then reused for the lifetime of this object.
 * <p>
 * The supplier is invoked at most once successfully, also when several threads ask for the value at the same time.
 * If the supplier throws, nothing is cached and the next call tries again.
 *
 * @param <T> the type of the value
 */
public final class Memoized<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Supplier<T> supplier;

    // null until the value has been computed
    private volatile Computed<T> computed;

    public Memoized(Supplier<T> supplier) {
        this.supplier = Objects.requireNonNull(supplier);
    }

    public T get() {
        Computed<T> current = computed;
        if (current != null) {
            return current.value();
        }
        try (ResourceLock ignored = lockAsResource()) {
            if (computed == null) {
                computed = new Computed<>(supplier.get());
            }
            return computed.value();
        }
    }

    public boolean isComputed() {
        return computed != null;
    }

    private ResourceLock lockAsResource() {
        lock.lock();
        return lock::unlock;
    }

    private record Computed<T>(T value) {
    }

    private interface ResourceLock extends AutoCloseable {
        @Override
        void close();
    }
}
