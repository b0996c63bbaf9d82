package fr.lapetina.llmrelay.retry;

import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.Request;

/**
 * Performs one outbound attempt of a request against one channel.
 *
 * <p>Implementations report every outcome through the returned {@link DispatchResult}
 * rather than by throwing. The result always carries a terminal execution with its
 * start, first-chunk and end timestamps. When the token is cancelled during the call,
 * the implementation aborts it, releases the connection and reports
 * {@link fr.lapetina.llmrelay.domain.model.ErrorType#CANCELLED}.
 */
public interface Dispatcher {

    /**
     * @param request  request being relayed
     * @param channel  selected channel
     * @param attempt  1-based attempt number within the request
     * @param token    cancellation signal of the request
     * @param listener receives streamed chunks as they arrive
     */
    DispatchResult dispatch(
            Request request,
            Channel channel,
            int attempt,
            CancellationToken token,
            ChunkListener listener
    );
}
