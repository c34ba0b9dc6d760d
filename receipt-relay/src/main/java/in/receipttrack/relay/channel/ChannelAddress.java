package in.receipttrack.relay.channel;

import java.util.Objects;

/**
 * Where events are published: a project and a topic inside it.
 */
public record ChannelAddress(String projectId, String topicId) {

    public ChannelAddress {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(topicId, "topicId");
        if (projectId.isBlank() || topicId.isBlank()) {
            throw new IllegalArgumentException("projectId and topicId must not be blank");
        }
    }

    @Override
    public String toString() {
        return projectId + "/" + topicId;
    }
}
