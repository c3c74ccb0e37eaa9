package relay.spi;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sink for operator alerts.
 */
@FunctionalInterface
public interface OperatorAlerts {

    /**
     * Default sink that writes alerts to the {@code relay.alerts} logger at SEVERE.
     */
    OperatorAlerts LOGGING = new Logging();

    void raise(Alert alert);

    final class Logging implements OperatorAlerts {
        private static final Logger logger = Logger.getLogger("relay.alerts");

        @Override
        public void raise(Alert alert) {
            logger.log(Level.SEVERE, "ALERT " + alert.kind() + " accountId=" + alert.accountId()
                + " subjectId=" + alert.subjectId() + ": " + alert.detail());
        }
    }
}
