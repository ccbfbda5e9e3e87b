package org.javai.retry;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Objects;
import java.util.Optional;

/**
 * Safe accessors for reading classification data off arbitrary exceptions.
 *
 * <p>Failures coming back from remote services rarely share a type hierarchy, so
 * predicates often need "the {@code code} of this exception, if it has one". These
 * helpers look the value up by name and return empty instead of throwing when the
 * exception does not carry it.</p>
 *
 * <p>Lookup order for {@link #field(Throwable, String)}:</p>
 * <ol>
 *   <li>a public no-argument method with the given name ({@code code()})</li>
 *   <li>a public no-argument getter ({@code getCode()})</li>
 *   <li>a field with the given name, declared on the class or a superclass</li>
 * </ol>
 *
 * <p>Fields are only read when neither accessor exists. A field the caller's module
 * cannot open (a private field of a JDK exception, for instance) reads as empty.</p>
 */
public final class Failures {

    private static final String CODE = "code";

    private Failures() {
        // Utility class
    }

    /**
     * Reads a named value from a failure.
     *
     * @param failure the failure to inspect, may be null
     * @param name the field or accessor name
     * @return the value, or empty if absent, null or unreadable
     */
    public static Optional<Object> field(Throwable failure, String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (failure == null || name.isBlank()) {
            return Optional.empty();
        }
        Class<?> type = failure.getClass();

        Optional<Object> viaMethod = invokeAccessor(failure, type, name);
        if (viaMethod.isPresent()) {
            return viaMethod;
        }
        Optional<Object> viaGetter = invokeAccessor(failure, type, getterName(name));
        if (viaGetter.isPresent()) {
            return viaGetter;
        }
        return readField(failure, type, name);
    }

    /**
     * Reads a named value from a failure, falling back to a default.
     */
    public static Object field(Throwable failure, String name, Object defaultValue) {
        return field(failure, name).orElse(defaultValue);
    }

    /**
     * Returns the classification code of a failure: {@link Classifiable#code()} when
     * implemented, otherwise a value named {@code code} rendered as a string.
     */
    public static Optional<String> code(Throwable failure) {
        if (failure instanceof Classifiable classifiable) {
            Optional<String> code = classifiable.code();
            return code != null ? code : Optional.empty();
        }
        return field(failure, CODE).map(String::valueOf);
    }

    private static Optional<Object> invokeAccessor(Throwable failure, Class<?> type, String name) {
        try {
            Method method = type.getMethod(name);
            if (Modifier.isStatic(method.getModifiers()) || method.getReturnType() == void.class) {
                return Optional.empty();
            }
            if (!method.canAccess(failure) && !method.trySetAccessible()) {
                return Optional.empty();
            }
            return Optional.ofNullable(method.invoke(failure));
        } catch (ReflectiveOperationException | RuntimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Object> readField(Throwable failure, Class<?> type, String name) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            try {
                Field field = current.getDeclaredField(name);
                if (Modifier.isStatic(field.getModifiers())) {
                    return Optional.empty();
                }
                if (!field.canAccess(failure) && !field.trySetAccessible()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(field.get(failure));
            } catch (NoSuchFieldException e) {
                // keep walking up the hierarchy
            } catch (ReflectiveOperationException | RuntimeException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String getterName(String name) {
        return "get" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
