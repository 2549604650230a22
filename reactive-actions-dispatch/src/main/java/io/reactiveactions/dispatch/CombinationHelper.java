package io.reactiveactions.dispatch;

import io.reactiveactions.core.ResponseAction;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Joins a collection producer and a count producer, the common shape of list actions.
 *
 * <pre>{@code
 * return combination.renderList("index", "book", books.list(max, offset), books.count());
 * // Render("index", {bookList: [...], bookCount: n})
 * }</pre>
 */
public final class CombinationHelper {

    private final ResponseActions actions;

    public CombinationHelper(ResponseActions actions) {
        this.actions = Objects.requireNonNull(actions, "actions");
    }

    public <T> ResultProducer<CombinedResult<T>> combine(ResultProducer<? extends List<? extends T>> items,
                                                         ResultProducer<? extends Number> count) {
        return ResultProducer.zip(items, count, (List<? extends T> list, Number total) ->
                new CombinedResult<T>(Collections.<T>unmodifiableList(list), total.longValue()));
    }

    public <T> ResultProducer<ResponseAction> renderList(String viewName,
                                                         String modelPrefix,
                                                         ResultProducer<? extends List<? extends T>> items,
                                                         ResultProducer<? extends Number> count) {
        Objects.requireNonNull(viewName, "viewName");
        Objects.requireNonNull(modelPrefix, "modelPrefix");
        return this.<T>combine(items, count).map(result -> actions.render(viewName, result.toModel(modelPrefix)));
    }
}
