package com.tracewire.proxy.core.hooks;

import com.tracewire.proxy.core.exceptions.HookException;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves hook identifiers from the configuration to hook instances.
 * <p>
 * An identifier first matches a {@link ServiceLoader} provider of the
 * requested type by fully qualified or simple class name (case-insensitive),
 * then falls back to loading it as a class name with a public no-arg
 * constructor.
 * </p>
 */
public final class HookLoader {

    private static final Logger log = LoggerFactory.getLogger(HookLoader.class);

    private HookLoader() {
        // Utility class
    }

    /**
     * Loads and binds a hook.
     * 
     * @param identifier   Configured identifier; blank means no hook.
     * @param type         Hook interface.
     * @param options      Hook options.
     * @param initialState Initial hook state.
     * @param <T>          Hook type.
     * @return The binding, or {@code null} if {@code identifier} is blank.
     * @throws HookException if the identifier cannot be resolved.
     */
    public static <T> HookBinding<T> bind(String identifier, Class<T> type, Map<String, Object> options,
            Object initialState) {
        if (identifier == null || identifier.isBlank()) {
            return null;
        }
        String id = identifier.trim();
        return new HookBinding<>(id, load(id, type), options, initialState);
    }

    /**
     * Loads a hook instance.
     * 
     * @param identifier Provider name or class name.
     * @param type       Hook interface.
     * @param <T>        Hook type.
     * @return A new hook instance.
     * @throws HookException if the identifier cannot be resolved.
     */
    public static <T> T load(String identifier, Class<T> type) {
        T provided = findProvider(identifier, type);
        if (provided != null) {
            return provided;
        }

        try {
            Class<?> clazz = Class.forName(identifier, true, Thread.currentThread().getContextClassLoader());
            if (!type.isAssignableFrom(clazz)) {
                throw new HookException(identifier + " does not implement " + type.getSimpleName());
            }
            return type.cast(clazz.getDeclaredConstructor().newInstance());
        } catch (ClassNotFoundException e) {
            throw new HookException("Unknown " + type.getSimpleName() + ": " + identifier, e);
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new HookException("Cannot instantiate " + type.getSimpleName() + " " + identifier + ": "
                    + e.getMessage(), e);
        }
    }

    private static <T> T findProvider(String identifier, Class<T> type) {
        try {
            for (T provider : ServiceLoader.load(type)) {
                Class<?> clazz = provider.getClass();
                if (identifier.equalsIgnoreCase(clazz.getName())
                        || identifier.equalsIgnoreCase(clazz.getSimpleName())) {
                    return provider;
                }
            }
        } catch (ServiceConfigurationError e) {
            log.warn("Failed to scan {} providers: {}", type.getSimpleName(), e.getMessage());
        }
        return null;
    }
}
