package io.stakemining.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stakemining.core.ManualClock;
import io.stakemining.core.config.MiningConfig;
import io.stakemining.core.identity.IdentityIssuer;
import io.stakemining.core.identity.IdentityProof;
import io.stakemining.core.node.MiningNode;
import io.stakemining.core.node.NodeConfig;
import io.stakemining.core.protocol.Amounts;
import io.stakemining.core.protocol.Hashes;
import io.stakemining.core.protocol.Keys;
import io.stakemining.core.session.SignedClose;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerIntegrationTest {

    private static final String ALICE = "alice123456";
    private static final String TOKEN = "api-secret";

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private final IdentityIssuer issuer = IdentityIssuer.generate();
    private final ManualClock clock = new ManualClock(1_700_000_000L);

    private ApiServer server;
    private MiningNode node;
    private int port;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (node != null) {
            node.close();
        }
    }

    private void startNode(NodeConfig nodeConfig) throws Exception {
        node = MiningNode.inMemory(nodeConfig, MiningConfig.defaults(), issuer.verifier(), clock);
        node.start();
        port = freePort();
        server = new ApiServer(node.sessions(), "127.0.0.1", port, TOKEN);
        server.start();
    }

    @Test
    void openThenCloseAfterCooldown() throws Exception {
        startNode(NodeConfig.defaultLocal());
        KeyPair aliceKeys = Keys.generate();
        String alice = Keys.deriveAddress(aliceKeys.getPublic());
        node.spendToken().mint(alice, 10 * Amounts.UNIT);
        node.spendToken().approve(alice, "mining-pool", 5 * Amounts.UNIT);

        HttpResponse<String> opened = post("/session/open", openBody(alice, "bob654321", 5 * Amounts.UNIT));
        assertEquals(200, opened.statusCode(), opened.body());
        JsonNode openJson = mapper.readTree(opened.body());
        assertEquals(alice, openJson.get("caller").asText());
        assertEquals(5 * Amounts.UNIT, openJson.get("amount").asLong());

        JsonNode status = mapper.readTree(get("/session?caller=" + alice).body());
        assertEquals("COOLING_DOWN", status.get("phase").asText());
        assertEquals("bob654321", status.get("referral").asText());
        long openedAt = status.get("openedAt").asLong();

        HttpResponse<String> early = post("/session/close", closeBody(aliceKeys, openedAt));
        assertEquals(400, early.statusCode());
        assertEquals("cooldown_not_elapsed", mapper.readTree(early.body()).get("error").asText());

        clock.advanceHours(24);
        HttpResponse<String> closed = post("/session/close", closeBody(aliceKeys, openedAt));
        assertEquals(200, closed.statusCode(), closed.body());
        JsonNode closeJson = mapper.readTree(closed.body());
        assertEquals(0, closeJson.get("level").asInt());
        assertEquals(50_000_000L, closeJson.get("total").asLong());
        assertEquals(50_000_000L, node.rewardToken().balanceOf(alice));
    }

    @Test
    void closeSignedByAnotherKeyIsForbidden() throws Exception {
        startNode(NodeConfig.defaultLocal());
        KeyPair aliceKeys = Keys.generate();
        String alice = Keys.deriveAddress(aliceKeys.getPublic());
        node.spendToken().mint(alice, 10 * Amounts.UNIT);
        node.spendToken().approve(alice, "mining-pool", Amounts.UNIT);
        assertEquals(200, post("/session/open", openBody(alice, null, Amounts.UNIT)).statusCode());
        long openedAt = node.sessions().status(alice).openedAt();
        clock.advanceHours(24);

        KeyPair malloryKeys = Keys.generate();
        SignedClose forged = SignedClose.sign(malloryKeys, "mining-pool", openedAt, clock.epochSecond() + 600);
        String body = mapper.createObjectNode()
                .put("caller", alice)
                .put("openedAt", openedAt)
                .put("deadline", forged.deadline())
                .put("signature", Hashes.toHex(forged.signature()))
                .put("publicKey", Base64.getEncoder().encodeToString(malloryKeys.getPublic().getEncoded()))
                .toString();

        HttpResponse<String> response = post("/session/close", body);
        assertEquals(403, response.statusCode());
        JsonNode json = mapper.readTree(response.body());
        assertEquals("close_not_authorized", json.get("error").asText());
        assertEquals("access", json.get("category").asText());
        assertEquals("CLAIMABLE", mapper.readTree(get("/session?caller=" + alice).body()).get("phase").asText());
        assertEquals(400, post("/session/close", "{\"caller\":\"" + alice + "\"}").statusCode());
    }

    @Test
    void duplicateOpenMapsToBadRequest() throws Exception {
        startNode(NodeConfig.defaultLocal());
        node.spendToken().approve(ALICE, "mining-pool", 10 * Amounts.UNIT);

        assertEquals(200, post("/session/open", openBody(ALICE, null, Amounts.UNIT)).statusCode());
        HttpResponse<String> again = post("/session/open", openBody(ALICE, null, Amounts.UNIT));
        assertEquals(400, again.statusCode());
        JsonNode body = mapper.readTree(again.body());
        assertEquals("already_mining", body.get("error").asText());
        assertEquals("input", body.get("category").asText());
    }

    @Test
    void lowTreasuryMapsToServiceUnavailable() throws Exception {
        startNode(NodeConfig.defaultLocal().withTreasuryFunding(1));
        node.spendToken().approve(ALICE, "mining-pool", Amounts.UNIT);

        HttpResponse<String> response = post("/session/open", openBody(ALICE, null, Amounts.UNIT));
        assertEquals(503, response.statusCode());
        assertEquals("insufficient_reserve", mapper.readTree(response.body()).get("error").asText());
        assertTrue(response.headers().firstValue("Retry-After").isPresent());
    }

    @Test
    void proofForAnotherCallerIsUnprocessable() throws Exception {
        startNode(NodeConfig.defaultLocal());
        node.spendToken().approve(ALICE, "mining-pool", Amounts.UNIT);
        IdentityProof proof = issuer.issue("person-" + ALICE, "bob654321", node.sessions().scope());

        HttpResponse<String> response = post("/session/open", mapper.createObjectNode()
                .put("caller", ALICE)
                .put("amount", Amounts.UNIT)
                .put("root", Hashes.toHex(proof.root()))
                .put("fingerprint", proof.fingerprint().hex())
                .put("proof", Hashes.toHex(proof.proof()))
                .toString());
        assertEquals(422, response.statusCode());
        assertEquals("proof_invalid", mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void queriesReportEstimateReserveAndReferral() throws Exception {
        startNode(NodeConfig.defaultLocal());

        JsonNode estimate = mapper.readTree(get("/reward/estimate?amount=" + Amounts.UNIT).body());
        assertEquals(10_000_000L, estimate.get("minimum").asLong());
        assertEquals(105_100_000L, estimate.get("maximum").asLong());

        JsonNode reserve = mapper.readTree(get("/reserve?totalStake=" + Amounts.UNIT).body());
        assertEquals(85_995_000L, reserve.get("requiredReserve").asLong());

        JsonNode referral = mapper.readTree(get("/referral/eligible?caller=" + ALICE).body());
        assertFalse(referral.get("eligible").asBoolean());

        JsonNode status = mapper.readTree(get("/status").body());
        assertEquals(0, status.get("activeSessions").asLong());
        assertEquals(10, status.get("config").get("levelCount").asInt());

        assertEquals(400, get("/reserve?totalStake=lots").statusCode());
        assertEquals(400, get("/reward/estimate").statusCode());
    }

    @Test
    void requestsWithoutTokenAreRejected() throws Exception {
        startNode(NodeConfig.defaultLocal());
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + "/status"))
                .GET()
                .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(401, response.statusCode());

        HttpRequest withApiKey = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + "/status"))
                .header("X-API-Key", TOKEN)
                .GET()
                .build();
        assertEquals(200, http.send(withApiKey, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void wrongMethodAndOpenApiDocument() throws Exception {
        startNode(NodeConfig.defaultLocal());
        assertEquals(405, get("/session/open").statusCode());
        HttpResponse<String> doc = get("/openapi.json");
        assertEquals(200, doc.statusCode());
        assertTrue(doc.body().contains("\"/session/open\""));
        String metrics = get("/metrics").body();
        assertTrue(metrics.contains("mining.sessions.opened"));
        assertTrue(metrics.contains("endpoint=open_session"));
        assertTrue(metrics.contains("mining.treasury.balance{stat=VALUE} "
                + (double) node.rewardToken().balanceOf("mining-pool")));
    }

    private String openBody(String caller, String referral, long amount) {
        IdentityProof proof = issuer.issue("person-" + caller, caller, node.sessions().scope());
        var body = mapper.createObjectNode()
                .put("caller", caller)
                .put("amount", amount)
                .put("root", Hashes.toHex(proof.root()))
                .put("fingerprint", proof.fingerprint().hex())
                .put("proof", Hashes.toHex(proof.proof()));
        if (referral != null) {
            body.put("referral", referral);
        }
        return body.toString();
    }

    private String closeBody(KeyPair callerKeys, long openedAt) {
        SignedClose request = SignedClose.sign(callerKeys, "mining-pool", openedAt, clock.epochSecond() + 600);
        return mapper.createObjectNode()
                .put("caller", request.caller())
                .put("openedAt", request.sessionOpenedAt())
                .put("deadline", request.deadline())
                .put("signature", Hashes.toHex(request.signature()))
                .put("publicKey", Base64.getEncoder().encodeToString(callerKeys.getPublic().getEncoded()))
                .toString();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .header("Authorization", "Bearer " + TOKEN)
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .header("Authorization", "Bearer " + TOKEN)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
