/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.model;

import java.io.IOException;

/**
 * A call to the remote repository failed.
 */
public class RemoteOperationException extends IOException {

    public enum Kind {
        NOT_FOUND,
        AUTH,
        NETWORK,
        WRITE
    }

    private final Kind kind;

    public RemoteOperationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RemoteOperationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
