package org.abstractica.arena.impl.protocol;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import org.abstractica.arena.ClientMessage;
import org.abstractica.arena.GameStateSnapshot;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Converts between JSON payloads and protocol types.
 *
 * <p>Client messages are objects with a {@code type} tag. Server snapshots are
 * objects of the form {@code {"players":[...],"boss":...}} with snake_case
 * field names and explicit nulls.</p>
 */
public final class MessageCodec
{
    public static final String TYPE_PLAYER_ACTION = "player_action";
    public static final String TYPE_SKILL_USE = "skill_use";

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .serializeNulls()
            .create();

    private static final TypeAdapter<JsonElement> TREE_ADAPTER = GSON.getAdapter(JsonElement.class);

    private MessageCodec() {}

    // ========== Client Messages ==========

    /**
     * Decodes a client message.
     *
     * @param payload the JSON text
     * @return the decoded message; unknown types yield {@link ClientMessage.Unrecognized}
     * @throws ProtocolException if the payload is not valid JSON, not an object,
     *                           or lacks a required field for its type
     */
    public static ClientMessage decode(String payload) throws ProtocolException
    {
        Objects.requireNonNull(payload, "payload");

        JsonElement root = parseStrict(payload);
        if (!root.isJsonObject())
        {
            throw new ProtocolException("Message is not a JSON object");
        }
        JsonObject object = root.getAsJsonObject();
        String type = requireString(object, "type");

        switch (type)
        {
            case TYPE_PLAYER_ACTION:
                return decodePlayerAction(object);
            case TYPE_SKILL_USE:
                return decodeSkillUse(object);
            default:
                return new ClientMessage.Unrecognized(type);
        }
    }

    /**
     * Parses exactly one JSON document. The reader stays strict, so comments,
     * single quotes, unquoted names and NaN are rejected.
     */
    private static JsonElement parseStrict(String payload) throws ProtocolException
    {
        JsonReader reader = new JsonReader(new StringReader(payload));
        try
        {
            JsonElement root = TREE_ADAPTER.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT)
            {
                throw new ProtocolException("Trailing data after JSON document");
            }
            return root;
        }
        catch (IOException | JsonParseException | IllegalStateException | NumberFormatException e)
        {
            throw new ProtocolException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    private static ClientMessage.PlayerAction decodePlayerAction(JsonObject object) throws ProtocolException
    {
        String action = requireString(object, "action");
        JsonElement data = object.get("data");
        Object value = data == null || data.isJsonNull() ? null : GSON.fromJson(data, Object.class);
        return new ClientMessage.PlayerAction(action, value);
    }

    private static ClientMessage.SkillUse decodeSkillUse(JsonObject object) throws ProtocolException
    {
        JsonElement index = object.get("skill_index");
        if (index == null || !index.isJsonPrimitive() || !index.getAsJsonPrimitive().isNumber())
        {
            throw new ProtocolException("skill_use requires integer field 'skill_index'");
        }

        int skillIndex;
        try
        {
            skillIndex = index.getAsBigDecimal().intValueExact();
        }
        catch (ArithmeticException | NumberFormatException e)
        {
            throw new ProtocolException("skill_index is not an integer: " + index, e);
        }

        JsonElement target = object.get("target_id");
        String targetId;
        if (target == null || target.isJsonNull())
        {
            targetId = null;
        }
        else if (target.isJsonPrimitive() && target.getAsJsonPrimitive().isString())
        {
            targetId = target.getAsString();
        }
        else
        {
            throw new ProtocolException("target_id must be a string or null");
        }

        return new ClientMessage.SkillUse(skillIndex, targetId);
    }

    private static String requireString(JsonObject object, String field) throws ProtocolException
    {
        JsonElement element = object.get(field);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString())
        {
            throw new ProtocolException("Missing or non-string field '" + field + "'");
        }
        return element.getAsString();
    }

    /**
     * Encodes a client message in its wire form.
     *
     * @param message a player action or skill use
     * @return the JSON text
     * @throws IllegalArgumentException for {@link ClientMessage.Unrecognized}
     */
    public static String encode(ClientMessage message)
    {
        Objects.requireNonNull(message, "message");

        JsonObject object = new JsonObject();
        if (message instanceof ClientMessage.PlayerAction action)
        {
            object.addProperty("type", TYPE_PLAYER_ACTION);
            object.addProperty("action", action.action());
            object.add("data", action.data() == null ? JsonNull.INSTANCE : GSON.toJsonTree(action.data()));
        }
        else if (message instanceof ClientMessage.SkillUse skillUse)
        {
            object.addProperty("type", TYPE_SKILL_USE);
            object.add("skill_index", new JsonPrimitive(skillUse.skillIndex()));
            object.add("target_id", skillUse.targetId() == null
                    ? JsonNull.INSTANCE
                    : new JsonPrimitive(skillUse.targetId()));
        }
        else
        {
            throw new IllegalArgumentException("Cannot encode " + message);
        }
        return GSON.toJson(object);
    }

    // ========== Snapshots ==========

    /**
     * Serializes a snapshot to its JSON text.
     *
     * @param snapshot the snapshot
     * @return {@code {"players":[...],"boss":...}}
     */
    public static String encodeSnapshot(GameStateSnapshot snapshot)
    {
        Objects.requireNonNull(snapshot, "snapshot");

        JsonObject object = new JsonObject();
        object.add("players", GSON.toJsonTree(snapshot.players()));
        object.add("boss", snapshot.boss() == null ? JsonNull.INSTANCE : GSON.toJsonTree(snapshot.boss()));
        return GSON.toJson(object);
    }

    /**
     * Serializes a snapshot straight to UTF-8 bytes.
     *
     * @param snapshot the snapshot
     * @return the encoded bytes
     */
    public static byte[] encodeSnapshotBytes(GameStateSnapshot snapshot)
    {
        return encodeSnapshot(snapshot).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses a snapshot received from the server.
     *
     * @param payload the JSON text
     * @return the snapshot object
     * @throws ProtocolException if the payload is not a JSON object
     */
    public static JsonObject decodeSnapshot(String payload) throws ProtocolException
    {
        Objects.requireNonNull(payload, "payload");
        try
        {
            JsonElement root = JsonParser.parseString(payload);
            if (!root.isJsonObject())
            {
                throw new ProtocolException("Snapshot is not a JSON object");
            }
            return root.getAsJsonObject();
        }
        catch (JsonParseException e)
        {
            throw new ProtocolException("Invalid JSON: " + e.getMessage(), e);
        }
    }
}
