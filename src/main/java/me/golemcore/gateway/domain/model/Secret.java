package me.golemcore.gateway.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Opaque credential blob of a bot binding.
 *
 * <p>
 * Accepts either a bare JSON string or {@code {"value": ...}} on input. The
 * raw value never appears in {@link #toString()}; logs use
 * {@link #fingerprint()} instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Secret {

    private static final int FINGERPRINT_LENGTH = 12;

    private String value;

    @Builder.Default
    private Boolean present = false;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Secret fromJson(Object source) {
        if (source == null) {
            return null;
        }
        if (source instanceof Map<?, ?> map) {
            Object valueObj = map.get("value");
            Object presentObj = map.get("present");
            String value = valueObj != null ? String.valueOf(valueObj) : null;
            boolean present = presentObj instanceof Boolean flag && flag;
            return Secret.builder()
                    .value(value)
                    .present(present || (value != null && !value.isBlank()))
                    .build();
        }
        String value = String.valueOf(source);
        return Secret.builder()
                .value(value)
                .present(!value.isBlank())
                .build();
    }

    public static Secret of(String value) {
        return fromJson(value);
    }

    public static Secret redacted(Secret source) {
        if (source == null) {
            return null;
        }
        return Secret.builder()
                .value(null)
                .present(Boolean.TRUE.equals(source.getPresent()) || hasValue(source))
                .build();
    }

    public static String valueOrEmpty(Secret secret) {
        if (secret == null || secret.getValue() == null) {
            return "";
        }
        return secret.getValue();
    }

    public static boolean hasValue(Secret secret) {
        return secret != null && secret.getValue() != null && !secret.getValue().isBlank();
    }

    /**
     * Two secrets carry the same credential when their raw values are equal.
     */
    public static boolean sameValue(Secret left, Secret right) {
        byte[] a = valueOrEmpty(left).getBytes(StandardCharsets.UTF_8);
        byte[] b = valueOrEmpty(right).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(a, b);
    }

    /**
     * Short SHA-256 prefix of the value, safe to log.
     */
    public String fingerprint() {
        if (!hasValue(this)) {
            return "none";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, FINGERPRINT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "Secret[present=" + hasValue(this) + ", fingerprint=" + fingerprint() + "]";
    }
}
