package io.reactiveactions.spring.webmvc.starter;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.reactiveactions.core.ReactiveActionsException.EmptyResult;
import io.reactiveactions.core.ResponseAction;
import io.reactiveactions.dispatch.CombinationHelper;
import io.reactiveactions.dispatch.ControllerDispatcher;
import io.reactiveactions.dispatch.ErrorHandlers;
import io.reactiveactions.dispatch.ResponseActions;
import io.reactiveactions.json.jackson.JacksonJsonCodec;
import io.reactiveactions.json.spi.JsonCodec;
import io.reactiveactions.servlet.JsonBodies;
import io.reactiveactions.servlet.JsonViewRenderer;
import io.reactiveactions.servlet.ServletExchange;
import io.reactiveactions.servlet.ServletResponseApplier;
import io.reactiveactions.servlet.ViewRenderer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Reactive Actions with Spring WebMVC.
 *
 * <p>Provides default beans for {@link ResponseActions}, {@link ErrorHandlers},
 * {@link CombinationHelper}, {@link JsonCodec}, {@link JsonBodies}, {@link ViewRenderer},
 * {@link ServletResponseApplier} and the {@link ControllerDispatcher}. Each can be overridden by
 * defining your own bean.
 *
 * <p>No servlet is registered. Bind actions to URLs yourself:
 * <pre>{@code
 * @Bean
 * public ServletRegistrationBean<ActionServlet> showBook(ControllerDispatcher<ServletExchange> dispatcher,
 *                                                         BookService books) {
 *     ServletRegistrationBean<ActionServlet> reg = new ServletRegistrationBean<>(new ActionServlet(dispatcher,
 *         (ctx, actions) -> books.find(ctx.param("id").orElseThrow()).map(actions::respond)), "/books/show");
 *     reg.setAsyncSupported(true);
 *     return reg;
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass({ControllerDispatcher.class, ServletExchange.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(ReactiveActionsProperties.class)
public class ReactiveActionsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResponseActions reactiveActionsResponseActions() {
        return new ResponseActions();
    }

    /**
     * Default failure mapping, with {@link EmptyResult} answering {@code reactive-actions.empty-status}.
     */
    @Bean
    @ConditionalOnMissingBean
    public ErrorHandlers reactiveActionsErrorHandlers(ResponseActions actions, ReactiveActionsProperties properties) {
        ResponseAction empty = actions.status(properties.getEmptyStatus());
        return ErrorHandlers.defaults(actions).toBuilder()
                .on(EmptyResult.class, e -> empty)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public CombinationHelper reactiveActionsCombinationHelper(ResponseActions actions) {
        return new CombinationHelper(actions);
    }

    /**
     * Jackson codec over the application's {@link ObjectMapper} when there is one.
     */
    @Bean
    @ConditionalOnMissingBean
    public JsonCodec reactiveActionsJsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
        ObjectMapper mapper = objectMapper.getIfAvailable();
        return mapper != null ? new JacksonJsonCodec(mapper) : new JacksonJsonCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonBodies reactiveActionsJsonBodies(JsonCodec codec) {
        return new JsonBodies(codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public ViewRenderer reactiveActionsViewRenderer(JsonCodec codec) {
        return new JsonViewRenderer(codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public ServletResponseApplier reactiveActionsResponseApplier(JsonCodec codec, ViewRenderer viewRenderer) {
        return new ServletResponseApplier(codec, viewRenderer);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ControllerDispatcher<ServletExchange> reactiveActionsDispatcher(ServletResponseApplier applier,
                                                                          ResponseActions actions,
                                                                          ErrorHandlers errorHandlers,
                                                                          ReactiveActionsProperties properties) {
        return ControllerDispatcher.builder(applier)
                .responseActions(actions)
                .errorHandlers(errorHandlers)
                .emptyAction(actions.status(properties.getEmptyStatus()))
                .timeout(properties.getTimeout())
                .workerThreads(properties.getWorkerThreads())
                .threadNamePrefix(properties.getThreadNamePrefix())
                .build();
    }
}
