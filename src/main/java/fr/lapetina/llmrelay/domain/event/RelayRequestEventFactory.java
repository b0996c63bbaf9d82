package fr.lapetina.llmrelay.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link RelayRequestEvent} instances for the ring buffer.
 */
public final class RelayRequestEventFactory implements EventFactory<RelayRequestEvent> {

    @Override
    public RelayRequestEvent newInstance() {
        return new RelayRequestEvent();
    }
}
