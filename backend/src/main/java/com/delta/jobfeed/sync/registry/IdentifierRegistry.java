package com.delta.jobfeed.sync.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Persistent mapping from remote job id to the locally issued reference code shown in the feed.
 *
 * <p>A code, once issued, is never handed out again for the lifetime of the registry file, including codes
 * that were discarded by {@link #reissue(String)} or {@link #retire(String)}.
 */
public class IdentifierRegistry {
    private static final Logger log = LoggerFactory.getLogger(IdentifierRegistry.class);
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int FALLBACK_SUFFIX_DIGITS = 4;

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Random random;
    private final Clock clock;
    private final int codeLength;
    private final int maxAttempts;
    private final Map<String, String> codes = new LinkedHashMap<>();
    private final Set<String> retiredCodes = new HashSet<>();
    private final Set<String> issuedCodes = new HashSet<>();

    public IdentifierRegistry(Path file, ObjectMapper objectMapper, Random random, Clock clock, int codeLength, int maxAttempts) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.random = random;
        this.clock = clock;
        this.codeLength = codeLength;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public synchronized Optional<String> lookup(String externalId) {
        return Optional.ofNullable(codes.get(externalId));
    }

    /**
     * Issues a new code for the id. Any code the id held before is discarded.
     */
    public synchronized String assign(String externalId) {
        String previous = codes.get(externalId);
        String code = generateUniqueCode();
        codes.put(externalId, code);
        if (previous != null) {
            retiredCodes.add(previous);
            log.info("Reference code for {} reissued: {} -> {}", externalId, previous, code);
        }
        return code;
    }

    public synchronized String lookupOrAssign(String externalId) {
        String existing = codes.get(externalId);
        return existing != null ? existing : assign(externalId);
    }

    /**
     * Takes over a code that is already published for the id, for example by a feed written before this
     * registry existed. A different code the id held before is retired; if another id held the adopted code,
     * that mapping is dropped so the other id gets a fresh code when it next appears.
     *
     * @return whether the mapping changed
     */
    public synchronized boolean adopt(String externalId, String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Cannot adopt a blank reference code for " + externalId);
        }
        String previous = codes.get(externalId);
        if (code.equals(previous)) {
            return false;
        }
        Iterator<Map.Entry<String, String>> mappings = codes.entrySet().iterator();
        while (mappings.hasNext()) {
            Map.Entry<String, String> mapping = mappings.next();
            if (code.equals(mapping.getValue()) && !externalId.equals(mapping.getKey())) {
                log.warn("Reference code {} was mapped to {}; moving it to {}", code, mapping.getKey(), externalId);
                mappings.remove();
            }
        }
        codes.put(externalId, code);
        issuedCodes.add(code);
        retiredCodes.remove(code);
        if (previous != null) {
            retiredCodes.add(previous);
        }
        log.info("Adopted published reference code {} for {} (registry had {})", code, externalId, previous);
        return true;
    }

    public synchronized String reissue(String externalId) {
        return assign(externalId);
    }

    /**
     * Drops the mapping of a permanently retired record. Its code stays reserved.
     */
    public synchronized boolean retire(String externalId) {
        String code = codes.remove(externalId);
        if (code == null) {
            return false;
        }
        retiredCodes.add(code);
        return true;
    }

    public synchronized Map<String, String> mappings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(codes));
    }

    public synchronized int size() {
        return codes.size();
    }

    public synchronized void load() {
        codes.clear();
        retiredCodes.clear();
        issuedCodes.clear();
        if (!Files.exists(file)) {
            log.info("No reference code registry at {}; starting empty", file);
            return;
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            Iterator<Map.Entry<String, JsonNode>> fields = root.path("reference_mapping").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String code = entry.getValue().asText("");
                if (!code.isBlank()) {
                    codes.put(entry.getKey(), code);
                    issuedCodes.add(code);
                }
            }
            for (JsonNode retired : root.path("retired_codes")) {
                retiredCodes.add(retired.asText());
                issuedCodes.add(retired.asText());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read reference code registry " + file, e);
        }
        log.info("Loaded {} reference codes from {}", codes.size(), file);
    }

    public synchronized void persist() {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode mapping = root.putObject("reference_mapping");
        codes.forEach(mapping::put);
        ArrayNode retired = root.putArray("retired_codes");
        retiredCodes.stream().sorted().forEach(retired::add);
        root.put("updated_at", clock.instant().toString());
        root.put("total_mappings", codes.size());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to persist reference code registry " + file, e);
        }
    }

    private String generateUniqueCode() {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String candidate = randomCode(codeLength);
            if (issuedCodes.add(candidate)) {
                return candidate;
            }
        }
        String suffix = String.valueOf(clock.instant().getEpochSecond());
        suffix = suffix.substring(Math.max(0, suffix.length() - FALLBACK_SUFFIX_DIGITS));
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String fallback = randomCode(codeLength - FALLBACK_SUFFIX_DIGITS) + suffix;
            if (issuedCodes.add(fallback)) {
                log.warn("Reference code generation exhausted {} attempts; using timestamp-suffixed code {}", maxAttempts, fallback);
                return fallback;
            }
        }
        throw new IllegalStateException("Unable to generate a unique reference code after " + (2 * maxAttempts) + " attempts");
    }

    private String randomCode(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }
}
