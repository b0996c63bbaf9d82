package fr.lapetina.llmrelay.retry;

import fr.lapetina.llmrelay.domain.model.Channel;

/**
 * Takes a channel out of rotation after it hit an auto-disable threshold.
 */
@FunctionalInterface
public interface ChannelDisabler {

    ChannelDisabler NOOP = (channel, statusCode) -> { };

    /**
     * @param channel    channel to disable
     * @param statusCode upstream status that reached its threshold
     */
    void disable(Channel channel, int statusCode);
}
