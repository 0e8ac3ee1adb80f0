package org.abstractica.arena;

import java.util.Objects;

/**
 * Messages sent from client to server, decoded once from their JSON form.
 *
 * <p>This sealed interface allows exhaustive handling of message kinds,
 * including an explicit variant for kinds this server does not know.</p>
 */
public sealed interface ClientMessage permits
        ClientMessage.PlayerAction,
        ClientMessage.SkillUse,
        ClientMessage.Unrecognized
{
    /**
     * {@code {"type":"player_action","action":<string>,"data":<any>}}.
     *
     * @param action the action name
     * @param data   the action payload as plain Java values, or null
     */
    record PlayerAction(String action, Object data) implements ClientMessage
    {
        public PlayerAction
        {
            Objects.requireNonNull(action, "action");
        }
    }

    /**
     * {@code {"type":"skill_use","skill_index":<integer>,"target_id":<string|null>}}.
     *
     * @param skillIndex index into the player's skill list
     * @param targetId   the targeted entity id, or null
     */
    record SkillUse(int skillIndex, String targetId) implements ClientMessage
    {
    }

    /**
     * A well-formed message whose {@code type} is not known to this server.
     *
     * @param type the declared type
     */
    record Unrecognized(String type) implements ClientMessage
    {
        public Unrecognized
        {
            Objects.requireNonNull(type, "type");
        }
    }
}
