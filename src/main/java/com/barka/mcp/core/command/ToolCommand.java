package com.barka.mcp.core.command;

import com.barka.mcp.domain.PageRequest;
import com.barka.mcp.domain.Scope;

/**
 * Typed payload of one {@code (tool, action)} pair. Validated argument maps are bound to the
 * record declared by the action's contract; fields the action does not use are dropped there.
 */
public sealed interface ToolCommand
        permits ProjectCommand, TaskCommand, TeamCommand, SearchCommand, AnalyticsCommand, AssignmentCommand {

    /** Commands that accept the tenant scoping identifiers. */
    interface Scoped {
        String clientId();

        String organizationId();

        default Scope scope() {
            return new Scope(clientId(), organizationId());
        }
    }

    /** Listing commands. Absent values stay absent; the service picks its own defaults. */
    interface Paged {
        Integer page();

        Integer limit();

        default PageRequest pageRequest() {
            return new PageRequest(page(), limit());
        }
    }
}
