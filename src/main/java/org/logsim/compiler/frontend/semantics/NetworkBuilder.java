package org.logsim.compiler.frontend.semantics;

import org.logsim.compiler.api.IDevices;
import org.logsim.compiler.api.IMonitors;
import org.logsim.compiler.api.INetwork;
import org.logsim.compiler.diagnostics.CompilerLogger;
import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.names.NameTable;
import org.logsim.compiler.frontend.parser.ItemDescriptor;
import org.logsim.compiler.frontend.parser.NetworkDescription;
import org.logsim.compiler.frontend.parser.Section;

import java.util.List;

/**
 * Drives the collaborators from a syntactically valid {@link NetworkDescription}:
 * devices first, then connections and the completeness check, then monitors.
 * Each phase stops at its first fatal failure, and no later phase runs after one.
 */
public class NetworkBuilder {

    private final NameTable names;
    private final IDevices devices;
    private final INetwork network;
    private final IMonitors monitors;
    private final SemanticErrorHandler errorHandler;

    public NetworkBuilder(NameTable names, IDevices devices, INetwork network, IMonitors monitors,
                          SemanticErrorHandler errorHandler) {
        this.names = names;
        this.devices = devices;
        this.network = network;
        this.monitors = monitors;
        this.errorHandler = errorHandler;
    }

    /**
     * Builds the network.
     * @param description The parsed file.
     * @return true if no fatal semantic error occurred.
     */
    public boolean build(NetworkDescription description) {
        return buildDevices(description.items(Section.DEVICES))
                && buildConnections(description)
                && buildMonitors(description.items(Section.MONITOR));
    }

    private boolean buildDevices(List<ItemDescriptor> items) {
        for (ItemDescriptor item : items) {
            int typeId = item.get(0).id();
            int nameId = item.get(1).id();
            String property = item.size() == 3 ? names.resolve(item.get(2).id()).orElse(null) : null;
            int code = devices.makeDevice(nameId, typeId, property);
            if (errorHandler.handle(code, item)) {
                return false;
            }
        }
        CompilerLogger.debug("Built {} devices", items.size());
        return true;
    }

    private boolean buildConnections(NetworkDescription description) {
        List<ItemDescriptor> items = description.items(Section.CONNECT);
        for (ItemDescriptor item : items) {
            ConnectionRoles roles = ConnectionRoles.from(item);
            int code = network.makeConnection(roles.firstDevice().id(), roles.firstPortId(),
                    roles.secondDevice().id(), roles.secondPortId());
            if (errorHandler.handle(code, item)) {
                return false;
            }
        }
        if (!network.checkNetwork()) {
            Symbol at = items.isEmpty()
                    ? description.keywordSymbol(Section.CONNECT).orElse(null)
                    : items.get(items.size() - 1).last();
            errorHandler.reportUnconnectedInputs(at);
            return false;
        }
        CompilerLogger.debug("Built {} connections", items.size());
        return true;
    }

    private boolean buildMonitors(List<ItemDescriptor> items) {
        for (ItemDescriptor item : items) {
            Integer portId = item.size() == 3 ? item.get(2).id() : null;
            int code = monitors.makeMonitor(item.get(0).id(), portId);
            if (errorHandler.handle(code, item)) {
                return false;
            }
        }
        CompilerLogger.debug("Built {} monitors", items.size());
        return true;
    }
}
