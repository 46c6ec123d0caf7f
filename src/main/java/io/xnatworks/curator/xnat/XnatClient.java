/*
 * XNAT Scan Curator
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.curator.xnat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.xnatworks.curator.config.AppConfig;
import io.xnatworks.curator.engine.RepositoryClient;
import io.xnatworks.curator.model.DataIntegrityException;
import io.xnatworks.curator.model.RemoteOperationException;
import io.xnatworks.curator.model.Scan;
import io.xnatworks.curator.model.ScanField;
import io.xnatworks.curator.model.Session;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * XNAT REST API client for reading a subject's session and scans and for
 * writing scan fields back. Connects to a single XNAT project.
 *
 * Calls are not retried: a failure is reported to the caller as a
 * {@link RemoteOperationException}.
 */
public class XnatClient implements RepositoryClient, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(XnatClient.class);

    static final String SCAN_COLUMNS = "ID,type,series_description,quality,frames,xsiType";

    private final String baseUrl;
    private final String username;
    private final String password;
    private final String project;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private String jsessionId;

    public XnatClient(AppConfig.XnatConfig config) {
        this.baseUrl = config.getUrl().replaceAll("/$", "");
        this.username = config.getUsername();
        this.password = config.getPassword();
        this.project = config.getProject();

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getReadTimeoutSeconds(), TimeUnit.SECONDS)
                .build();

        log.debug("Created XnatClient for {} (project {})", baseUrl, project);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getProject() {
        return project;
    }

    /**
     * Authenticate and get JSESSION token.
     */
    public String authenticate() throws RemoteOperationException {
        String credential = Credentials.basic(username, password);

        Request request = new Request.Builder()
                .url(baseUrl + "/data/JSESSION")
                .post(RequestBody.create("", null))
                .header("Authorization", credential)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful() && response.body() != null) {
                jsessionId = response.body().string().trim();
                log.debug("Authenticated with XNAT {}, JSESSION: {}...",
                        baseUrl, jsessionId.substring(0, Math.min(8, jsessionId.length())));
                return jsessionId;
            }
            throw new RemoteOperationException(RemoteOperationException.Kind.AUTH,
                    "Authentication failed for " + baseUrl + ": HTTP " + response.code());
        } catch (RemoteOperationException e) {
            throw e;
        } catch (IOException e) {
            throw new RemoteOperationException(RemoteOperationException.Kind.NETWORK,
                    "Cannot reach " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    /**
     * Invalidate session.
     */
    public void invalidateSession(String sessionId) {
        if (sessionId == null) return;

        Request request = new Request.Builder()
                .url(baseUrl + "/data/JSESSION")
                .delete()
                .header("Cookie", "JSESSIONID=" + sessionId)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            log.debug("Session invalidated for {}", baseUrl);
        } catch (Exception e) {
            log.debug("Failed to invalidate session for {}: {}", baseUrl, e.getMessage());
        }
    }

    @Override
    public Session fetchSession(String subjectLabel) throws RemoteOperationException, DataIntegrityException {
        HttpUrl experimentsUrl = HttpUrl.get(baseUrl).newBuilder()
                .addPathSegments("data/projects")
                .addPathSegment(project)
                .addPathSegment("subjects")
                .addPathSegment(subjectLabel)
                .addPathSegment("experiments")
                .addQueryParameter("format", "json")
                .addQueryParameter("xsiType", "xnat:imageSessionData")
                .build();

        List<JsonNode> sessions = getResultSet(experimentsUrl, "subject " + subjectLabel);
        if (sessions.isEmpty()) {
            throw new RemoteOperationException(RemoteOperationException.Kind.NOT_FOUND,
                    "Subject " + subjectLabel + " has no imaging sessions in project " + project);
        }
        if (sessions.size() > 1) {
            throw new DataIntegrityException(DataIntegrityException.Kind.MULTIPLE_SESSIONS, subjectLabel,
                    "Subject has " + sessions.size() + " sessions in XNAT. Please combine them.");
        }

        JsonNode sessionRow = sessions.get(0);
        String sessionId = text(sessionRow, "ID");
        if (sessionId == null) {
            throw new DataIntegrityException(DataIntegrityException.Kind.MISSING_METADATA, subjectLabel,
                    "Session listing has no ID");
        }

        HttpUrl scansUrl = HttpUrl.get(baseUrl).newBuilder()
                .addPathSegments("data/experiments")
                .addPathSegment(sessionId)
                .addPathSegment("scans")
                .addQueryParameter("format", "json")
                .addQueryParameter("columns", SCAN_COLUMNS)
                .build();

        List<Scan> scans = new ArrayList<>();
        for (JsonNode row : getResultSet(scansUrl, "session " + sessionId)) {
            String xsiType = text(row, "xsiType");
            scans.add(Scan.builder(text(row, "ID"))
                    .type(text(row, "type"))
                    .seriesDescription(text(row, "series_description"))
                    .quality(text(row, "quality"))
                    .frames(integer(row, "frames"))
                    .xsiType(xsiType)
                    .modality(modalityOf(xsiType))
                    .build());
        }

        log.info("[{}] Fetched session {} with {} scan(s)", subjectLabel, sessionId, scans.size());
        return new Session(subjectLabel, sessionId, text(sessionRow, "label"),
                text(sessionRow, "project") != null ? text(sessionRow, "project") : project,
                text(sessionRow, "date"), scans);
    }

    @Override
    public void writeScanField(String sessionId, Scan scan, ScanField field, String value)
            throws RemoteOperationException {
        HttpUrl.Builder url = HttpUrl.get(baseUrl).newBuilder()
                .addPathSegments("data/experiments")
                .addPathSegment(sessionId)
                .addPathSegment("scans")
                .addPathSegment(scan.getId());
        if (scan.getXsiType() != null) {
            url.addQueryParameter("xsiType", scan.getXsiType());
            url.addQueryParameter(scan.getXsiType() + "/" + field.getXnatName(), value);
        } else {
            url.addQueryParameter(field.getXnatName(), value);
        }
        url.addQueryParameter("event_reason", "scan curation");

        ensureAuthenticated();
        Request request = new Request.Builder()
                .url(url.build())
                .put(RequestBody.create("", null))
                .header("Cookie", "JSESSIONID=" + jsessionId)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new RemoteOperationException(kindFor(response.code(), RemoteOperationException.Kind.WRITE),
                        "Writing " + field.getXnatName() + " of scan " + scan.getId() + " in " + sessionId
                                + " failed: HTTP " + response.code());
            }
            log.debug("Set {} of scan {} in {} to '{}'", field.getXnatName(), scan.getId(), sessionId, value);
        } catch (RemoteOperationException e) {
            throw e;
        } catch (IOException e) {
            throw new RemoteOperationException(RemoteOperationException.Kind.NETWORK,
                    "Writing scan " + scan.getId() + " in " + sessionId + " failed: " + e.getMessage(), e);
        }
    }

    private List<JsonNode> getResultSet(HttpUrl url, String what) throws RemoteOperationException {
        ensureAuthenticated();
        Request request = new Request.Builder()
                .url(url)
                .get()
                .header("Cookie", "JSESSIONID=" + jsessionId)
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new RemoteOperationException(kindFor(response.code(), RemoteOperationException.Kind.NETWORK),
                        "Failed to fetch " + what + " from " + baseUrl + ": HTTP " + response.code());
            }

            // Format: {"ResultSet":{"Result":[{...}, ...]}}
            JsonNode root = objectMapper.readTree(response.body() != null ? response.body().string() : "{}");
            List<JsonNode> rows = new ArrayList<>();
            for (JsonNode row : root.path("ResultSet").path("Result")) {
                rows.add(row);
            }
            return rows;
        } catch (RemoteOperationException e) {
            throw e;
        } catch (IOException e) {
            throw new RemoteOperationException(RemoteOperationException.Kind.NETWORK,
                    "Failed to fetch " + what + " from " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private void ensureAuthenticated() throws RemoteOperationException {
        if (jsessionId == null) {
            authenticate();
        }
    }

    static RemoteOperationException.Kind kindFor(int httpCode, RemoteOperationException.Kind fallback) {
        if (httpCode == 401 || httpCode == 403) {
            return RemoteOperationException.Kind.AUTH;
        }
        if (httpCode == 404) {
            return RemoteOperationException.Kind.NOT_FOUND;
        }
        return fallback;
    }

    /**
     * Modality from a scan data type: xnat:mrScanData -> MR, xnat:petScanData -> PT.
     */
    static String modalityOf(String xsiType) {
        if (xsiType == null) {
            return null;
        }
        String name = xsiType.contains(":") ? xsiType.substring(xsiType.indexOf(':') + 1) : xsiType;
        if (name.endsWith("ScanData")) {
            name = name.substring(0, name.length() - "ScanData".length());
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "pet":
                return "PT";
            case "otherdicom":
                return "OT";
            default:
                return name.toUpperCase(Locale.ROOT);
        }
    }

    private static String text(JsonNode row, String field) {
        JsonNode value = row.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static Integer integer(JsonNode row, String field) {
        String text = text(row, field);
        if (text == null) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {} value '{}'", field, text);
            return null;
        }
    }

    @Override
    public void close() {
        if (jsessionId != null) {
            invalidateSession(jsessionId);
            jsessionId = null;
        }
    }
}
