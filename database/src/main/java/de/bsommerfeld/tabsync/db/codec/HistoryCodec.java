package de.bsommerfeld.tabsync.db.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a tab's back-history to and from the JSON array of URL strings
 * stored in {@code tabs.history}.
 *
 * <p>
 * Decoding never fails: anything that is not a JSON array of strings yields
 * an empty history, and entries that do not parse as absolute URLs are
 * dropped individually.
 */
public final class HistoryCodec {

    private static final Logger LOG = LoggerFactory.getLogger(HistoryCodec.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private HistoryCodec() {
    }

    /**
     * Serializes the history, most recent first. {@code null}, empty and
     * relative entries are dropped, as are repeats of a URL already written.
     *
     * @return the JSON array, or {@code null} if serialization failed
     */
    public static String encode(List<URI> history) {
        Set<String> urls = new LinkedHashSet<>();
        if (history != null) {
            for (URI uri : history) {
                if (uri == null || !uri.isAbsolute())
                    continue;
                String url = uri.toString();
                if (!url.isEmpty())
                    urls.add(url);
            }
        }

        try {
            return MAPPER.writeValueAsString(urls);
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to serialize tab history of {} entries", urls.size(), e);
            return null;
        }
    }

    /** Decodes a stored history column. */
    public static List<URI> decode(String json) {
        if (json == null || json.isBlank())
            return Collections.emptyList();

        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            return Collections.emptyList();
        }
        if (root == null || !root.isArray())
            return Collections.emptyList();

        List<URI> history = new ArrayList<>(root.size());
        for (JsonNode entry : root) {
            // One non-string element means this is not a list of URLs at all
            if (!entry.isTextual())
                return Collections.emptyList();
            URI uri = parseAbsolute(entry.textValue());
            if (uri != null)
                history.add(uri);
        }
        return history;
    }

    /**
     * Decodes a history column that arrived as raw bytes. Bytes that are not
     * valid UTF-8 yield an empty history.
     */
    public static List<URI> decode(byte[] raw) {
        if (raw == null)
            return Collections.emptyList();
        try {
            String json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
            return decode(json);
        } catch (CharacterCodingException e) {
            return Collections.emptyList();
        }
    }

    /**
     * Parses an absolute URL.
     *
     * @return the URI, or {@code null} if the string is empty, malformed or
     *         relative
     */
    public static URI parseAbsolute(String url) {
        if (url == null || url.isEmpty())
            return null;
        try {
            URI uri = new URI(url);
            return uri.isAbsolute() ? uri : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
