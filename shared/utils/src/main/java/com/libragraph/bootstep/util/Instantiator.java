package com.libragraph.bootstep.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads classes and constructs objects by fully qualified name, for runtime plugin loading.
 * <p>
 * Constructors are matched by argument count and assignability; the first declared
 * match wins. Exceptions thrown by a constructor propagate unchanged when unchecked
 * and are wrapped in {@link InstantiationFailedException} otherwise.
 */
public final class Instantiator {

    private static final Map<Class<?>, Class<?>> BOXED = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class);

    private Instantiator() {
    }

    /** Loads and initializes the named class, running its static initializers. */
    public static Class<?> loadClass(String qualifiedName) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = Instantiator.class.getClassLoader();
        }
        try {
            return Class.forName(qualifiedName, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new InstantiationFailedException("Cannot load class '" + qualifiedName + "'", e);
        }
    }

    /** Loads the named class and constructs it, checking it is a {@code type}. */
    public static <T> T instantiate(String qualifiedName, Class<T> type, Object... args) {
        Class<?> cls = loadClass(qualifiedName);
        if (!type.isAssignableFrom(cls)) {
            throw new InstantiationFailedException(
                    "Class '" + qualifiedName + "' is not a " + type.getName());
        }
        return type.cast(instantiate(cls, args));
    }

    public static <T> T instantiate(Class<T> cls, Object... args) {
        Constructor<?> constructor = findConstructor(cls, args);
        try {
            constructor.setAccessible(true);
            return cls.cast(constructor.newInstance(args));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new InstantiationFailedException(
                    "Constructor of " + cls.getName() + " failed: " + cause.getMessage(), cause);
        } catch (ReflectiveOperationException | SecurityException e) {
            throw new InstantiationFailedException("Cannot instantiate " + cls.getName(), e);
        }
    }

    private static Constructor<?> findConstructor(Class<?> cls, Object[] args) {
        for (Constructor<?> candidate : cls.getDeclaredConstructors()) {
            if (accepts(candidate.getParameterTypes(), args)) {
                return candidate;
            }
        }
        String argTypes = Arrays.stream(args)
                .map(a -> a == null ? "null" : a.getClass().getSimpleName())
                .collect(Collectors.joining(", "));
        throw new InstantiationFailedException(
                "No constructor of " + cls.getName() + " accepts (" + argTypes + ")");
    }

    private static boolean accepts(Class<?>[] params, Object[] args) {
        if (params.length != args.length) return false;
        for (int i = 0; i < params.length; i++) {
            if (args[i] == null) {
                if (params[i].isPrimitive()) return false;
            } else if (!BOXED.getOrDefault(params[i], params[i]).isInstance(args[i])) {
                return false;
            }
        }
        return true;
    }
}
