package io.tiermesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tiermesh.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-GCM sealing for archive blobs, backed by a rotating keyring file.
 * Sealed output is a binary frame: the magic {@code TMG1}, a one-byte key id length,
 * the UTF-8 key id, the 12-byte IV, then ciphertext and tag. Blobs sealed before a
 * rotation stay readable.
 */
public final class PayloadCrypto {
    private static final byte[] MAGIC = {'T', 'M', 'G', '1'};
    private static final int MAX_KID_BYTES = 255;
    private static final String KEYRING_SCHEMA = "tiermesh.payload.keys.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private volatile Keyring keyring;

    public PayloadCrypto(Path keyFile) {
        this.keyFile = keyFile;
        this.secureRandom = new SecureRandom();
        this.keyring = loadOrCreateKeyring();
    }

    public byte[] seal(byte[] plaintext) {
        Keyring ring = keyring;
        SecretKeySpec key = ring.keys.get(ring.activeKid);
        if (key == null) {
            throw new IllegalStateException("Active payload key is missing: " + ring.activeKid);
        }
        byte[] kid = ring.activeKid.getBytes(StandardCharsets.UTF_8);
        if (kid.length > MAX_KID_BYTES) {
            throw new IllegalStateException("Payload key id too long: " + ring.activeKid);
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext);
            ByteBuffer frame = ByteBuffer.allocate(MAGIC.length + 1 + kid.length + GCM_IV_BYTES + cipherText.length);
            frame.put(MAGIC);
            frame.put((byte) kid.length);
            frame.put(kid);
            frame.put(iv);
            frame.put(cipherText);
            return frame.array();
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to seal payload", e);
        }
    }

    /**
     * Opens a frame produced by {@link #seal(byte[])}. Tries the recorded key id
     * first and falls back to the other keys in the ring.
     *
     * @throws GeneralSecurityException when the frame is malformed or no key authenticates it
     */
    public byte[] open(byte[] sealed) throws GeneralSecurityException {
        if (sealed == null || sealed.length < MAGIC.length + 1 + GCM_IV_BYTES + GCM_TAG_BITS / 8) {
            throw new GeneralSecurityException("Sealed payload is too short");
        }
        ByteBuffer frame = ByteBuffer.wrap(sealed);
        byte[] magic = new byte[MAGIC.length];
        frame.get(magic);
        if (!Arrays.equals(MAGIC, magic)) {
            throw new GeneralSecurityException("Unsupported sealed payload format");
        }
        int kidLength = frame.get() & 0xFF;
        if (frame.remaining() < kidLength + GCM_IV_BYTES + GCM_TAG_BITS / 8) {
            throw new GeneralSecurityException("Sealed payload is truncated");
        }
        byte[] kidBytes = new byte[kidLength];
        frame.get(kidBytes);
        String kid = new String(kidBytes, StandardCharsets.UTF_8);
        byte[] iv = new byte[GCM_IV_BYTES];
        frame.get(iv);
        byte[] cipherText = new byte[frame.remaining()];
        frame.get(cipherText);

        Keyring ring = keyring;
        SecretKeySpec exact = kid.isBlank() ? null : ring.keys.get(kid);
        if (exact != null) {
            return decrypt(cipherText, iv, exact);
        }
        GeneralSecurityException last = new GeneralSecurityException("No key in ring for kid " + kid);
        for (SecretKeySpec key : ring.keys.values()) {
            try {
                return decrypt(cipherText, iv, key);
            } catch (GeneralSecurityException e) {
                last.addSuppressed(e);
            }
        }
        throw last;
    }

    public synchronized RotationOutcome rotate() {
        Keyring current = keyring;
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(current.keys);
        String kid = nextKid(next);
        next.put(kid, newKey());
        Keyring rotated = new Keyring(kid, next);
        persistKeyring(rotated);
        keyring = rotated;
        return new RotationOutcome(current.activeKid, kid, next.size(), keyFile.toString());
    }

    public KeyringStatus status() {
        Keyring ring = keyring;
        return new KeyringStatus(ring.activeKid, ring.keys.size(), keyFile.toString());
    }

    private static byte[] decrypt(byte[] cipherText, byte[] iv, SecretKeySpec key) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
        return cipher.doFinal(cipherText);
    }

    private synchronized Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            return created;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String active = node.path("active_kid").asText("");
            JsonNode keysNode = node.path("keys");
            LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
            if (keysNode.isObject()) {
                keysNode.fieldNames().forEachRemaining(kid -> {
                    String rawBase64 = keysNode.path(kid).asText("");
                    if (kid.isBlank() || rawBase64.isBlank()) {
                        return;
                    }
                    keys.put(kid, new SecretKeySpec(Base64.getDecoder().decode(rawBase64), "AES"));
                });
            }
            if (keys.isEmpty()) {
                Keyring created = bootstrapKeyring();
                persistKeyring(created);
                return created;
            }
            if (!keys.containsKey(active)) {
                active = keys.keySet().iterator().next();
            }
            return new Keyring(active, keys);
        } catch (IOException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to load payload keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrapKeyring() {
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = nextKid(keys);
        keys.put(kid, newKey());
        return new Keyring(kid, keys);
    }

    private SecretKeySpec newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    private static String nextKid(Map<String, SecretKeySpec> existing) {
        long stamp = Instant.now().toEpochMilli();
        String kid = "k" + stamp;
        while (existing.containsKey(kid)) {
            kid = "k" + (++stamp);
        }
        return kid;
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            LinkedHashMap<String, String> keys = new LinkedHashMap<>();
            for (Map.Entry<String, SecretKeySpec> entry : ring.keys.entrySet()) {
                keys.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", KEYRING_SCHEMA);
            root.put("active_kid", ring.activeKid);
            root.set("keys", Jsons.mapper().valueToTree(keys));
            Path tmp = keyFile.resolveSibling(keyFile.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(root), StandardCharsets.UTF_8);
            Files.move(tmp, keyFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist payload keyring: " + keyFile, e);
        }
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }

    public record RotationOutcome(String previousKid, String activeKid, int totalKeys, String keyFile) {
    }

    public record KeyringStatus(String activeKid, int totalKeys, String keyFile) {
    }
}
