package org.assertflat.rewriter;

@FunctionalInterface
public interface RewriteListener {

    RewriteListener NONE = event -> { };

    void onRewrite(RewriteEvent event);

    default RewriteListener andThen(RewriteListener next) {
        return event -> {
            onRewrite(event);
            next.onRewrite(event);
        };
    }
}
