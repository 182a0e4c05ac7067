package io.repoexpert.core.ask;

import java.time.Duration;
import java.util.Objects;

public final class AskRouter {
    private final Duration askTimeout;
    private final Duration fastAskTimeout;

    public AskRouter(Duration askTimeout, Duration fastAskTimeout) {
        this.askTimeout = Objects.requireNonNull(askTimeout, "askTimeout must not be null");
        this.fastAskTimeout = Objects.requireNonNull(fastAskTimeout, "fastAskTimeout must not be null");
    }

    public AskRoutePlan plan(AskRoutingMode routing, String question, String fastModel) {
        String trimmedFastModel = fastModel == null ? "" : fastModel.trim();
        boolean useFast = !trimmedFastModel.isEmpty()
            && (routing == AskRoutingMode.SPEED
                || (routing == AskRoutingMode.AUTO && QuestionNormalizer.isSimpleQuestion(question)));

        if (useFast) {
            return new AskRoutePlan(trimmedFastModel, fastAskTimeout, askTimeout, true);
        }
        return new AskRoutePlan(null, askTimeout, askTimeout, false);
    }
}
