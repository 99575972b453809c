package io.stakemining.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.stakemining.core.identity.IdentityProof;
import io.stakemining.core.metrics.MiningMetrics;
import io.stakemining.core.protocol.Fingerprint;
import io.stakemining.core.protocol.Hashes;
import io.stakemining.core.protocol.Keys;
import io.stakemining.core.protocol.MiningException;
import io.stakemining.core.reward.RewardRange;
import io.stakemining.core.session.MiningSessions;
import io.stakemining.core.session.SessionFinished;
import io.stakemining.core.session.SessionOpened;
import io.stakemining.core.session.SessionStatus;
import io.stakemining.core.session.SignedClose;
import io.stakemining.core.state.PoolState;
import io.stakemining.core.token.SignedPermit;
import io.stakemining.core.token.TransferAuthorization;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Stake Mining API",
    "version": "1.0.0"
  },
  "paths": {
    "/status": {
      "get": {
        "summary": "Pool counters, treasury balance and active configuration",
        "responses": { "200": { "description": "Status response" }, "401": { "description": "Auth required" } }
      }
    },
    "/session": {
      "get": {
        "summary": "Session phase for an address",
        "parameters": [
          { "name": "caller", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Session status" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/session/open": {
      "post": {
        "summary": "Stake and open a mining session",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": { "$ref": "#/components/schemas/OpenSession" } } }
        },
        "responses": {
          "200": { "description": "Session opened" },
          "400": { "description": "Rejected input" },
          "422": { "description": "Identity proof or stake transfer failed" },
          "503": { "description": "Treasury reserve too low, retry later" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/session/close": {
      "post": {
        "summary": "Close the caller's session and claim the reward",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": { "$ref": "#/components/schemas/CloseSession" } } }
        },
        "responses": {
          "200": { "description": "Session finished with reward breakdown" },
          "400": { "description": "No open session or cooldown not elapsed" },
          "403": { "description": "Close request not signed by the session owner" },
          "422": { "description": "Reward transfer failed" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/reward/estimate": {
      "get": {
        "summary": "Reward range for a stake amount (minor units)",
        "parameters": [
          { "name": "amount", "in": "query", "required": true, "schema": { "type": "integer", "format": "int64" } }
        ],
        "responses": { "200": { "description": "Reward range" }, "400": { "description": "Invalid amount" } }
      }
    },
    "/referral/eligible": {
      "get": {
        "summary": "Whether the caller's open session currently earns the referral bonus",
        "parameters": [
          { "name": "caller", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Eligibility" } }
      }
    },
    "/reserve": {
      "get": {
        "summary": "Required treasury reserve for a hypothetical total active stake",
        "parameters": [
          { "name": "totalStake", "in": "query", "required": true, "schema": { "type": "integer", "format": "int64" } }
        ],
        "responses": { "200": { "description": "Required reserve" }, "400": { "description": "Invalid amount" } }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Metrics in text exposition format" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "Return this OpenAPI document",
        "responses": { "200": { "description": "OpenAPI specification" } }
      }
    }
  },
  "components": {
    "schemas": {
      "OpenSession": {
        "type": "object",
        "required": ["caller", "amount", "root", "fingerprint", "proof"],
        "properties": {
          "caller": { "type": "string" },
          "referral": { "type": "string" },
          "amount": { "type": "integer", "format": "int64" },
          "root": { "type": "string", "description": "hex" },
          "fingerprint": { "type": "string", "description": "hex, 32 bytes" },
          "proof": { "type": "string", "description": "hex" },
          "permit": { "$ref": "#/components/schemas/Permit" }
        }
      },
      "Permit": {
        "type": "object",
        "description": "Signed permit; when absent the stake is pulled from a prior allowance",
        "required": ["maxAmount", "nonce", "deadline", "signature", "publicKey"],
        "properties": {
          "maxAmount": { "type": "integer", "format": "int64" },
          "nonce": { "type": "integer", "format": "int64" },
          "deadline": { "type": "integer", "format": "int64" },
          "signature": { "type": "string", "description": "hex" },
          "publicKey": { "type": "string", "format": "byte" }
        }
      },
      "CloseSession": {
        "type": "object",
        "description": "Signed by the caller's key over the pool, caller, session openedAt and deadline",
        "required": ["caller", "openedAt", "deadline", "signature", "publicKey"],
        "properties": {
          "caller": { "type": "string" },
          "openedAt": { "type": "integer", "format": "int64" },
          "deadline": { "type": "integer", "format": "int64" },
          "signature": { "type": "string", "description": "hex" },
          "publicKey": { "type": "string", "format": "byte" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final MiningSessions sessions;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(MiningSessions sessions, String bindAddress, int port, String authToken) {
        this.sessions = sessions;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("API server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/status", new StatusHandler());
        server.createContext("/session", new SessionStatusHandler());
        server.createContext("/session/open", new OpenSessionHandler());
        server.createContext("/session/close", new CloseSessionHandler());
        server.createContext("/reward/estimate", new EstimateHandler());
        server.createContext("/referral/eligible", new ReferralHandler());
        server.createContext("/reserve", new ReserveHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "API server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /**
     * Shared plumbing: method check, optional token auth, metrics and error mapping.
     */
    abstract class Endpoint implements HttpHandler {
        private final String endpoint;
        private final String allowedMethod;

        Endpoint(String endpoint, String allowedMethod) {
            this.endpoint = endpoint;
            this.allowedMethod = allowedMethod;
        }

        abstract int respond(HttpExchange exchange) throws IOException;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = MiningMetrics.startRequest();
            int status = 500;
            try {
                if (!exchange.getRequestURI().getPath().equals(path)) {
                    status = sendError(exchange, 404, "not_found", "No such endpoint");
                    return;
                }
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange);
            } catch (MiningException e) {
                status = sendMiningError(exchange, e);
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "invalid_request", Optional.ofNullable(e.getMessage()).orElse("Invalid request"));
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Request to " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                MiningMetrics.recordRequest(sample, endpoint, method, status);
                exchange.close();
            }
        }
    }

    final class StatusHandler extends Endpoint {
        StatusHandler() { super("status", "GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            PoolState pool = sessions.pool();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("pool", sessions.poolAddress());
            resp.put("activeSessions", pool.activeSessions());
            resp.put("activeStake", pool.activeStake());
            resp.put("treasury", sessions.treasuryBalance());
            resp.put("requiredReserve", sessions.requiredReserve(pool.activeStake()));
            resp.set("config", mapper.valueToTree(sessions.config()));
            return sendJson(exchange, 200, resp);
        }
    }

    final class SessionStatusHandler extends Endpoint {
        SessionStatusHandler() { super("session_status", "GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String caller = queryParam(exchange.getRequestURI(), "caller");
            if (caller == null || caller.isBlank()) {
                return sendError(exchange, 400, "missing_caller", "Query parameter 'caller' is required");
            }
            SessionStatus s = sessions.status(caller);
            ObjectNode resp = mapper.createObjectNode()
                    .put("caller", s.caller())
                    .put("phase", s.phase().name());
            if (s.fingerprint() != null) {
                resp.put("fingerprint", s.fingerprint().hex());
                resp.put("openedAt", s.openedAt());
                resp.put("unlocksAt", s.unlocksAt());
                resp.put("stakedAmount", s.stakedAmount());
                resp.put("referral", s.referralTarget());
            }
            return sendJson(exchange, 200, resp);
        }
    }

    final class OpenSessionHandler extends Endpoint {
        OpenSessionHandler() { super("open_session", "POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            OpenSessionRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), OpenSessionRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse open session request");
            }
            if (req == null || req.caller == null || req.root == null || req.fingerprint == null || req.proof == null) {
                return sendError(exchange, 400, "missing_fields", "Fields 'caller', 'root', 'fingerprint' and 'proof' are required");
            }
            IdentityProof proof = new IdentityProof(
                    Hashes.fromHex(req.root), Fingerprint.fromHex(req.fingerprint), Hashes.fromHex(req.proof));
            TransferAuthorization authorization = req.permit == null
                    ? TransferAuthorization.allowance()
                    : new SignedPermit(req.permit.maxAmount, req.permit.nonce, req.permit.deadline,
                            Hashes.fromHex(req.permit.signature),
                            Keys.decodePublicKey(Base64.getDecoder().decode(req.permit.publicKey)));
            SessionOpened opened = sessions.openSession(req.caller, req.referral, req.amount, proof, authorization);
            ObjectNode resp = mapper.createObjectNode()
                    .put("status", "ok")
                    .put("caller", opened.caller())
                    .put("referral", opened.referralTarget())
                    .put("fingerprint", opened.fingerprint().hex())
                    .put("amount", opened.amount())
                    .put("openedAt", opened.openedAt());
            return sendJson(exchange, 200, resp);
        }
    }

    final class CloseSessionHandler extends Endpoint {
        CloseSessionHandler() { super("close_session", "POST"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            CloseSessionRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), CloseSessionRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse close session request");
            }
            if (req == null || req.caller == null || req.caller.isBlank() || req.signature == null || req.publicKey == null) {
                return sendError(exchange, 400, "missing_fields",
                        "Fields 'caller', 'openedAt', 'deadline', 'signature' and 'publicKey' are required");
            }
            SignedClose request = new SignedClose(req.caller, req.openedAt, req.deadline,
                    Hashes.fromHex(req.signature),
                    Keys.decodePublicKey(Base64.getDecoder().decode(req.publicKey)));
            SessionFinished f = sessions.closeSession(request);
            ObjectNode resp = mapper.createObjectNode()
                    .put("status", "ok")
                    .put("caller", f.caller())
                    .put("referral", f.referralTarget())
                    .put("fingerprint", f.fingerprint().hex())
                    .put("total", f.totalReward())
                    .put("payout", f.payout())
                    .put("referralBonus", f.referralBonus())
                    .put("streakBonus", f.streakBonus())
                    .put("streakCount", f.streakCount())
                    .put("referralApplied", f.referralApplied())
                    .put("level", f.rewardLevel())
                    .put("stakedAmount", f.stakedAmount())
                    .put("finishedAt", f.finishedAt());
            return sendJson(exchange, 200, resp);
        }
    }

    final class EstimateHandler extends Endpoint {
        EstimateHandler() { super("estimate", "GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            long amount = longParam(exchange.getRequestURI(), "amount");
            RewardRange range = sessions.estimateReward(amount);
            ObjectNode resp = mapper.createObjectNode()
                    .put("amount", range.stakeAmount())
                    .put("minimum", range.minimum())
                    .put("maximum", range.maximum())
                    .put("maxReferralBonus", range.maxReferralBonus())
                    .put("streakBonus", range.streakBonus());
            return sendJson(exchange, 200, resp);
        }
    }

    final class ReferralHandler extends Endpoint {
        ReferralHandler() { super("referral_eligible", "GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String caller = queryParam(exchange.getRequestURI(), "caller");
            if (caller == null || caller.isBlank()) {
                return sendError(exchange, 400, "missing_caller", "Query parameter 'caller' is required");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("caller", caller)
                    .put("eligible", sessions.isReferralEligible(caller));
            return sendJson(exchange, 200, resp);
        }
    }

    final class ReserveHandler extends Endpoint {
        ReserveHandler() { super("reserve", "GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            long totalStake = longParam(exchange.getRequestURI(), "totalStake");
            ObjectNode resp = mapper.createObjectNode()
                    .put("totalStake", totalStake)
                    .put("requiredReserve", sessions.requiredReserve(totalStake))
                    .put("treasury", sessions.treasuryBalance());
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() { super("metrics", "GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            byte[] payload = MiningMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends Endpoint {
        OpenApiHandler() { super("openapi", "GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    static class OpenSessionRequest {
        public String caller;
        public String referral;
        public long amount;
        public String root;
        public String fingerprint;
        public String proof;
        public PermitRequest permit;
    }

    static class PermitRequest {
        public long maxAmount;
        public long nonce;
        public long deadline;
        public String signature;
        public String publicKey;
    }

    static class CloseSessionRequest {
        public String caller;
        public long openedAt;
        public long deadline;
        public String signature;
        public String publicKey;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    static int statusFor(MiningException e) {
        return switch (e.error().category()) {
            case INPUT -> 400;
            case CAPACITY -> 503;
            case EXTERNAL -> 422;
            case ACCESS -> 403;
        };
    }

    private int sendMiningError(HttpExchange exchange, MiningException e) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", e.error().code());
        node.put("category", e.error().category().name().toLowerCase(java.util.Locale.ROOT));
        node.put("message", e.getMessage());
        if (e.error().retryable()) {
            exchange.getResponseHeaders().set("Retry-After", "60");
        }
        return sendJson(exchange, statusFor(e), node);
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static long longParam(URI uri, String name) {
        String raw = queryParam(uri, name);
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Query parameter '" + name + "' is required");
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Query parameter '" + name + "' must be an integer");
        }
    }

    private static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
