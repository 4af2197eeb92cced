package com.purchasingpower.flowgraph.exception;

import com.purchasingpower.flowgraph.core.EntityKind;
import lombok.Getter;

@Getter
public class NotFoundException extends FlowGraphException {

    private final EntityKind kind;
    private final String name;

    public NotFoundException(EntityKind kind, String name) {
        super(ErrorCode.NOT_FOUND, kind.getLabel() + " not found: " + name);
        this.kind = kind;
        this.name = name;
    }

    public NotFoundException(EntityKind kind, String name, String message) {
        super(ErrorCode.NOT_FOUND, message);
        this.kind = kind;
        this.name = name;
    }
}
