/* (C)2026 */
package com.ammann.logquery.service;

import com.ammann.logquery.exception.ResponseEncodingException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPOutputStream;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Decides whether a response body is gzip-compressed and performs the compression.
 *
 * <p>Compression applies when {@code logquery.compression.enabled} is set and the caller's
 * {@code Accept-Encoding} lists {@code gzip} (or {@code *}) with a non-zero quality.
 */
@ApplicationScoped
public class ResponseCompressionService {

    private final boolean enabled;

    @Inject
    public ResponseCompressionService(
            @ConfigProperty(name = "logquery.compression.enabled", defaultValue = "true") boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @param acceptEncoding raw {@code Accept-Encoding} header, may be {@code null}
     * @return whether the response should be gzip-encoded
     */
    public boolean shouldCompress(String acceptEncoding) {
        if (!enabled || acceptEncoding == null || acceptEncoding.isBlank()) {
            return false;
        }
        for (String token : acceptEncoding.split(",")) {
            String[] parts = token.split(";");
            String coding = parts[0].trim();
            if (!"gzip".equalsIgnoreCase(coding) && !"*".equals(coding)) {
                continue;
            }
            if (!hasZeroQuality(parts)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param body uncompressed bytes
     * @return gzip-encoded bytes
     */
    public byte[] gzip(byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, body.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(body);
        } catch (IOException e) {
            throw new ResponseEncodingException(e);
        }
        return out.toByteArray();
    }

    private static boolean hasZeroQuality(String[] parts) {
        for (int i = 1; i < parts.length; i++) {
            String parameter = parts[i].trim();
            if (parameter.startsWith("q=")) {
                try {
                    return Double.parseDouble(parameter.substring(2).trim()) <= 0.0;
                } catch (NumberFormatException e) {
                    return true;
                }
            }
        }
        return false;
    }
}
