package io.github.drompincen.javacron.runtime.tools;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ToolActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolActionRegistry.class);
    private final Map<String, ToolAction> actions = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolActionRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadActions() {
        ServiceLoader<ToolAction> loader = ServiceLoader.load(ToolAction.class);
        for (ToolAction action : loader) {
            injectDependencies(action);
            register(action);
        }
        log.info("Loaded {} tool actions via SPI", actions.size());
    }

    public void register(ToolAction action) {
        actions.put(key(action.toolType(), action.actionId()), action);
        log.debug("Registered tool action: {}/{}", action.toolType(), action.actionId());
    }

    public Optional<ToolAction> get(String toolType, String actionId) {
        if (toolType == null || actionId == null) return Optional.empty();
        return Optional.ofNullable(actions.get(key(toolType, actionId)));
    }

    /** The message-sending action of a tool type, used by conditional actions. */
    public Optional<ToolAction> messageActionFor(String toolType) {
        if (toolType == null) return Optional.empty();
        String type = toolType.toLowerCase(Locale.ROOT);
        return actions.values().stream()
                .filter(a -> a.toolType().equals(type) && a.sendsMessages())
                .min(Comparator.comparing(ToolAction::actionId));
    }

    public Collection<ToolAction> all() {
        return Collections.unmodifiableCollection(actions.values());
    }

    private static String key(String toolType, String actionId) {
        return toolType.toLowerCase(Locale.ROOT) + "/" + actionId;
    }

    private void injectDependencies(ToolAction action) {
        for (Method method : action.getClass().getMethods()) {
            if (method.getName().startsWith("set") && method.getParameterCount() == 1) {
                Class<?> paramType = method.getParameterTypes()[0];
                try {
                    Object bean = applicationContext.getBean(paramType);
                    method.invoke(action, bean);
                    log.debug("Injected {} into {}.{}", paramType.getSimpleName(),
                            action.getClass().getSimpleName(), method.getName());
                } catch (NoSuchBeanDefinitionException e) {
                    log.trace("No bean of type {} for {}.{}", paramType.getSimpleName(),
                            action.getClass().getSimpleName(), method.getName());
                } catch (Exception e) {
                    log.warn("Failed to inject {} into {}.{}: {}", paramType.getSimpleName(),
                            action.getClass().getSimpleName(), method.getName(), e.getMessage());
                }
            }
        }
    }
}
