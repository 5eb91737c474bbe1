package com.intteq.queue.client.internal;

import com.intteq.queue.client.annotation.MessageHandlerBinding;
import com.intteq.queue.client.handler.HandlerDescriptor;
import com.intteq.queue.client.handler.HandlerKind;
import com.intteq.queue.client.handler.MessageHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.GenericTypeResolver;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Discovers {@link MessageHandlerBinding} beans and registers them with the
 * {@link MessageHandlerRegistry}.
 *
 * <p>Beans are looked up by name on every delivery, never here, so prototype-scoped handlers
 * are not instantiated at startup and get a fresh instance per message.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class MessageHandlerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final MessageHandlerRegistry registry;

    @Override
    public void afterSingletonsInstantiated() {
        log.info("Discovering @MessageHandlerBinding beans...");

        List<Candidate> candidates = new ArrayList<>();
        for (String beanName : beanFactory.getBeanNamesForAnnotation(MessageHandlerBinding.class)) {
            Class<?> type = beanFactory.getType(beanName);
            if (type == null) {
                throw new IllegalStateException("Cannot determine type of handler bean '" + beanName + "'");
            }
            Class<?> userType = ClassUtils.getUserClass(type);
            MessageHandlerBinding binding = AnnotationUtils.findAnnotation(userType, MessageHandlerBinding.class);
            if (binding != null) {
                candidates.add(new Candidate(beanName, userType, binding));
            }
        }

        // stable: equal orders keep bean definition order
        candidates.sort(Comparator.comparingInt(c -> c.binding.order()));
        candidates.forEach(this::register);
    }

    private void register(Candidate candidate) {
        String[] routingKeys = candidate.binding.routingKeys();
        if (routingKeys.length == 0) {
            throw new IllegalStateException("@MessageHandlerBinding on bean '" + candidate.beanName
                    + "' declares no routing keys");
        }

        HandlerKind kind = HandlerKind.of(candidate.type);
        Class<?> payloadType = GenericTypeResolver.resolveTypeArgument(candidate.type, kind.getContract());
        if (payloadType == null) {
            throw new IllegalStateException("Cannot resolve payload type of handler bean '"
                    + candidate.beanName + "' (" + candidate.type.getName() + ")");
        }

        String beanName = candidate.beanName;
        HandlerDescriptor descriptor = HandlerDescriptor.forType(
                beanName, candidate.type, payloadType, () -> beanFactory.getBean(beanName));

        for (String routingKey : routingKeys) {
            registry.register(routingKey, descriptor);
        }

        log.info("Handler registered → bean={} kind={} payload={} routingKeys={}{}",
                beanName, kind, payloadType.getSimpleName(), List.of(routingKeys),
                candidate.binding.description().isEmpty() ? "" : " (" + candidate.binding.description() + ")");
    }

    private static final class Candidate {
        private final String beanName;
        private final Class<?> type;
        private final MessageHandlerBinding binding;

        private Candidate(String beanName, Class<?> type, MessageHandlerBinding binding) {
            this.beanName = beanName;
            this.type = type;
            this.binding = binding;
        }
    }
}
