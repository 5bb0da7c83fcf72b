package org.logsim.compiler.frontend.parser;

import org.logsim.compiler.frontend.parser.features.connect.ConnectionItemHandler;
import org.logsim.compiler.frontend.parser.features.device.DeviceItemHandler;
import org.logsim.compiler.frontend.parser.features.monitor.MonitorItemHandler;

import java.util.EnumMap;
import java.util.Map;

/**
 * A registry for item handlers. This class maps each section to the handler for its items.
 */
public class ItemHandlerRegistry {
    private final Map<Section, IItemHandler> handlers = new EnumMap<>(Section.class);

    /**
     * Registers a handler, replacing any earlier one for the section.
     * @param section The section.
     * @param handler The handler for the section's items.
     */
    public void register(Section section, IItemHandler handler) {
        handlers.put(section, handler);
    }

    /**
     * @param section The section.
     * @return The handler for the section's items.
     * @throws IllegalStateException if no handler is registered for the section.
     */
    public IItemHandler get(Section section) {
        IItemHandler handler = handlers.get(section);
        if (handler == null) {
            throw new IllegalStateException("No item handler registered for section " + section);
        }
        return handler;
    }

    /**
     * Initializes the registry with the built-in handlers.
     * @return A new registry with a handler for every section.
     */
    public static ItemHandlerRegistry initialize() {
        ItemHandlerRegistry registry = new ItemHandlerRegistry();
        registry.register(Section.DEVICES, new DeviceItemHandler());
        registry.register(Section.CONNECT, new ConnectionItemHandler());
        registry.register(Section.MONITOR, new MonitorItemHandler());
        return registry;
    }
}
