package com.dochelper.rules.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

public final class CommonUtil {

    private CommonUtil() {
    }

    public static boolean isNullOrBlank(final String str) {
        return str == null || str.trim().isEmpty();
    }

    public static boolean isNotBlank(final String str) {
        return str != null && !str.trim().isEmpty();
    }

    public static <T> boolean isNotEmpty(final Collection<T> collection) {
        return collection != null && !collection.isEmpty();
    }

    public static <K, V> Map<K, V> nonNullMap(Map<K, V> map) {
        return Optional.ofNullable(map).orElse(Collections.emptyMap());
    }

    public static String readResource(String classpathLocation) throws IOException {
        try (InputStream inputStream = CommonUtil.class.getClassLoader().getResourceAsStream(classpathLocation)) {
            if (inputStream == null) {
                throw new IOException("Classpath resource not found: " + classpathLocation);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static String extensionOf(String location) {
        int dot = location.lastIndexOf('.');
        return dot < 0 ? "" : location.substring(dot + 1).toLowerCase();
    }
}
