package org.abstractica.arena.impl.protocol;

import com.google.gson.JsonObject;
import org.abstractica.arena.ClientMessage;
import org.abstractica.arena.GameStateSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MessageCodec}.
 */
class MessageCodecTest
{
    record PlayerView(String playerId, int maxHealth, boolean isAlive) {}

    record BossView(String id, List<Double> position) {}

    // ========== player_action ==========

    @Test
    void decode_playerAction() throws ProtocolException
    {
        ClientMessage message = MessageCodec.decode(
                "{\"type\":\"player_action\",\"action\":\"move\",\"data\":{\"dx\":1,\"dy\":-0.5}}");

        ClientMessage.PlayerAction action = assertInstanceOf(ClientMessage.PlayerAction.class, message);
        assertEquals("move", action.action());
        Map<?, ?> data = assertInstanceOf(Map.class, action.data());
        assertEquals(1.0, ((Number) data.get("dx")).doubleValue());
        assertEquals(-0.5, ((Number) data.get("dy")).doubleValue());
    }

    @Test
    void decode_playerActionWithoutData() throws ProtocolException
    {
        ClientMessage.PlayerAction action = (ClientMessage.PlayerAction)
                MessageCodec.decode("{\"type\":\"player_action\",\"action\":\"stop\"}");

        assertEquals("stop", action.action());
        assertNull(action.data());
    }

    @Test
    void decode_playerActionMissingAction()
    {
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"player_action\",\"data\":{}}"));
    }

    @Test
    void decode_playerActionNonStringAction()
    {
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"player_action\",\"action\":7}"));
    }

    // ========== skill_use ==========

    @Test
    void decode_skillUseWithTarget() throws ProtocolException
    {
        ClientMessage message = MessageCodec.decode(
                "{\"type\":\"skill_use\",\"skill_index\":2,\"target_id\":\"boss\"}");

        assertEquals(new ClientMessage.SkillUse(2, "boss"), message);
    }

    @Test
    void decode_skillUseNullOrAbsentTarget() throws ProtocolException
    {
        assertEquals(new ClientMessage.SkillUse(0, null),
                MessageCodec.decode("{\"type\":\"skill_use\",\"skill_index\":0,\"target_id\":null}"));
        assertEquals(new ClientMessage.SkillUse(1, null),
                MessageCodec.decode("{\"type\":\"skill_use\",\"skill_index\":1}"));
    }

    @Test
    void decode_skillUseIntegralFloat() throws ProtocolException
    {
        assertEquals(new ClientMessage.SkillUse(1, null),
                MessageCodec.decode("{\"type\":\"skill_use\",\"skill_index\":1.0}"));
    }

    @Test
    void decode_skillUseInvalidIndex()
    {
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"skill_use\",\"skill_index\":1.5}"));
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"skill_use\",\"skill_index\":\"1\"}"));
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"skill_use\"}"));
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"skill_use\",\"skill_index\":99999999999}"));
    }

    @Test
    void decode_skillUseNonStringTarget()
    {
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"skill_use\",\"skill_index\":0,\"target_id\":5}"));
    }

    // ========== Other Input ==========

    @Test
    void decode_unknownTypeIsUnrecognized() throws ProtocolException
    {
        ClientMessage message = MessageCodec.decode("{\"type\":\"unknown_kind\",\"x\":1}");

        assertEquals(new ClientMessage.Unrecognized("unknown_kind"), message);
    }

    @Test
    void decode_invalidJson()
    {
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{not json"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode(""));
    }

    @Test
    void decode_lenientSyntaxRejected()
    {
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{type:'skill_use', skill_index:1, target_id:boss}"));
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{'type':'player_action','action':'stop'}"));
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"player_action\"; \"action\":\"stop\" /* c */}"));
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"player_action\",\"action\":\"move\",\"data\":NaN}"));
    }

    @Test
    void decode_trailingContentRejected()
    {
        assertThrows(ProtocolException.class,
                () -> MessageCodec.decode("{\"type\":\"player_action\",\"action\":\"stop\"} {}"));
    }

    @Test
    void decode_surroundingWhitespaceAccepted() throws ProtocolException
    {
        assertEquals(new ClientMessage.SkillUse(0, null),
                MessageCodec.decode("  {\"type\":\"skill_use\",\"skill_index\":0}\n"));
    }

    @Test
    void decode_notAnObject()
    {
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("[1,2,3]"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("\"player_action\""));
    }

    @Test
    void decode_missingOrNonStringType()
    {
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{\"action\":\"move\"}"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decode("{\"type\":3}"));
    }

    // ========== Encoding ==========

    @Test
    void encode_decodesBackToSameMessage() throws ProtocolException
    {
        ClientMessage skill = new ClientMessage.SkillUse(1, null);
        ClientMessage action = new ClientMessage.PlayerAction("stop", null);

        assertEquals(skill, MessageCodec.decode(MessageCodec.encode(skill)));
        assertEquals(action, MessageCodec.decode(MessageCodec.encode(action)));
    }

    @Test
    void encode_skillUseWireForm()
    {
        String json = MessageCodec.encode(new ClientMessage.SkillUse(1, "boss"));

        assertEquals("{\"type\":\"skill_use\",\"skill_index\":1,\"target_id\":\"boss\"}", json);
    }

    @Test
    void encode_unrecognizedThrows()
    {
        assertThrows(IllegalArgumentException.class,
                () -> MessageCodec.encode(new ClientMessage.Unrecognized("x")));
    }

    // ========== Snapshots ==========

    @Test
    void encodeSnapshot_emptyWithExplicitNullBoss()
    {
        assertEquals("{\"players\":[],\"boss\":null}", MessageCodec.encodeSnapshot(GameStateSnapshot.empty()));
    }

    @Test
    void encodeSnapshot_usesSnakeCaseFieldNames()
    {
        GameStateSnapshot snapshot = new GameStateSnapshot(
                List.of(new PlayerView("player_1", 200, true)),
                new BossView("boss", List.of(400.0, 300.0)));

        String json = MessageCodec.encodeSnapshot(snapshot);

        assertEquals("{\"players\":[{\"player_id\":\"player_1\",\"max_health\":200,\"is_alive\":true}],"
                + "\"boss\":{\"id\":\"boss\",\"position\":[400.0,300.0]}}", json);
    }

    @Test
    void decodeSnapshot_parsesObject() throws ProtocolException
    {
        JsonObject state = MessageCodec.decodeSnapshot("{\"players\":[{\"id\":\"player_1\"}],\"boss\":null}");

        assertEquals(1, state.getAsJsonArray("players").size());
        assertTrue(state.get("boss").isJsonNull());
    }

    @Test
    void decodeSnapshot_rejectsNonObject()
    {
        assertThrows(ProtocolException.class, () -> MessageCodec.decodeSnapshot("Server full"));
        assertThrows(ProtocolException.class, () -> MessageCodec.decodeSnapshot("[]"));
    }
}
