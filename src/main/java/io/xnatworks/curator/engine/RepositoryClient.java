/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.engine;

import io.xnatworks.curator.model.DataIntegrityException;
import io.xnatworks.curator.model.RemoteOperationException;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.model.ScanField;
import io.xnatworks.curator.model.Session;

/**
 * Read and write access to the imaging repository.
 * Implementations do not retry; a failed call is reported to the caller.
 */
public interface RepositoryClient {

    /**
     * Fetch the single imaging session of a subject with all of its scans.
     *
     * @throws RemoteOperationException NOT_FOUND, AUTH or NETWORK
     * @throws DataIntegrityException   if the archive data cannot form one session
     */
    Session fetchSession(String subjectLabel) throws RemoteOperationException, DataIntegrityException;

    /**
     * Set one field of one scan.
     *
     * @throws RemoteOperationException WRITE (or AUTH/NETWORK) on failure
     */
    void writeScanField(String sessionId, Scan scan, ScanField field, String value) throws RemoteOperationException;
}
