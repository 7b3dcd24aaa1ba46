package org.assertflat.rewriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener: applied rewrites at debug, declined chains at trace, failures at warn.
 */
public class LoggingRewriteListener implements RewriteListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRewriteListener.class);

    @Override
    public void onRewrite(RewriteEvent event) {
        switch (event.getKind()) {
            case APPLIED:
                log.debug("{}:{} {} rewritten by {}", event.getDocumentName(), event.getLine(), event.getSignature(), event.getRuleName());
                break;
            case REJECTED:
                log.trace("{}:{} {} left unchanged ({})", event.getDocumentName(), event.getLine(), event.getSignature(),
                        event.getRuleName() == null ? "no rule" : event.getRuleName() + " declined");
                break;
            case FAILED:
                log.warn("{}:{} {} failed in {}, left unchanged", event.getDocumentName(), event.getLine(), event.getSignature(),
                        event.getRuleName(), event.getFailure());
                break;
            default:
                throw new IllegalStateException("Unknown event kind " + event.getKind());
        }
    }
}
