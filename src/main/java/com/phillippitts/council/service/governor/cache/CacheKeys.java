package com.phillippitts.council.service.governor.cache;

import com.phillippitts.council.service.gateway.ChatMessage;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Deterministic cache keys: SHA-256 over the backend id and the JSON form of the resolved
 * messages.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String forCall(String backendId, List<ChatMessage> messages) {
        JSONArray array = new JSONArray();
        for (ChatMessage m : messages) {
            array.put(new JSONObject().put("role", m.role()).put("content", m.content()));
        }
        String material = backendId + '\n' + array;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
