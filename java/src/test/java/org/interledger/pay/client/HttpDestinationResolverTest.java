package org.interledger.pay.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;
import org.interledger.pay.model.Amount;
import org.interledger.pay.model.Asset;
import org.interledger.pay.model.Destination;
import org.interledger.pay.model.Invoice;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

class HttpDestinationResolverTest {

    static WireMockServer wm;
    static final byte[] SECRET = new byte[32];
    static final String SECRET_B64;

    static {
        Arrays.fill(SECRET, (byte) 7);
        SECRET_B64 = Base64.getEncoder().encodeToString(SECRET);
    }

    HttpDestinationResolver resolver;
    String base;

    @BeforeAll
    static void startServer() {
        wm = new WireMockServer(0);   // random port
        wm.start();
    }

    @AfterAll
    static void stopServer() { wm.stop(); }

    @BeforeEach
    void setUp() {
        wm.resetAll();
        base = "http://localhost:" + wm.port();
        resolver = new HttpDestinationResolver(Duration.ofMillis(500), true);
    }

    private PaymentError failure(PaymentTarget target) {
        PaymentException ex = assertThrows(PaymentException.class, () -> resolver.resolve(target));
        return ex.getError();
    }

    private void stubJson(String path, String body) {
        wm.stubFor(get(urlEqualTo(path))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody(body)));
    }

    private String invoiceJson(String account, String amount, String received) {
        return "{\"id\":\"" + base + "/alice/invoices/123\","
            + "\"account\":\"" + account + "\","
            + "\"amount\":\"" + amount + "\",\"received\":\"" + received + "\","
            + "\"assetCode\":\"USD\",\"assetScale\":2,"
            + "\"expiresAt\":\"2030-01-01T00:00:00Z\",\"description\":\"Coffee\","
            + "\"ilpAddress\":\"g.wallet.alice.inv123\",\"sharedSecret\":\"" + SECRET_B64 + "\"}";
    }

    @Test
    void resolvesSpspPointer() throws Exception {
        wm.stubFor(get(urlEqualTo("/alice"))
            .withHeader("Accept", containing("application/spsp4+json"))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/spsp4+json")
                .withBody("{\"destination_account\":\"g.wallet.alice\",\"shared_secret\":\"" + SECRET_B64
                    + "\",\"receipts_enabled\":false}")));

        Destination destination = resolver.resolve(PaymentTarget.paymentPointer(base + "/alice"));

        assertEquals("g.wallet.alice", destination.getDestinationAddress());
        assertArrayEquals(SECRET, destination.getSharedSecret());
        assertTrue(destination.getDestinationAsset().isEmpty());
        assertEquals(base + "/alice", destination.getAccountUrl().orElseThrow());
    }

    @Test
    void pointerWithoutPathQueriesWellKnown() throws Exception {
        stubJson("/.well-known/pay",
            "{\"destination_account\":\"g.wallet.root\",\"shared_secret\":\"" + SECRET_B64 + "\"}");

        Destination destination = resolver.resolve(PaymentTarget.paymentPointer(base));

        assertEquals("g.wallet.root", destination.getDestinationAddress());
        assertEquals(base + "/.well-known/pay", destination.getAccountUrl().orElseThrow());
    }

    @Test
    void resolvesOpenPaymentsAccountWithAsset() throws Exception {
        stubJson("/bob", "{\"id\":\"" + base + "/bob\",\"accountServicer\":\"" + base + "\","
            + "\"ilpAddress\":\"g.wallet.bob\",\"sharedSecret\":\"" + SECRET_B64 + "\","
            + "\"assetCode\":\"USD\",\"assetScale\":2}");

        Destination destination = resolver.resolve(PaymentTarget.paymentPointer(base + "/bob"));

        assertEquals("g.wallet.bob", destination.getDestinationAddress());
        assertEquals(new Asset("USD", 2), destination.getDestinationAsset().orElseThrow());
        assertEquals(base + "/bob", destination.getAccountUrl().orElseThrow());
    }

    @Test
    void followsRedirects() throws Exception {
        wm.stubFor(get(urlEqualTo("/old")).willReturn(aResponse().withStatus(302).withHeader("Location", base + "/alice")));
        stubJson("/alice", "{\"destination_account\":\"g.wallet.alice\",\"shared_secret\":\"" + SECRET_B64 + "\"}");

        assertEquals("g.wallet.alice",
            resolver.resolve(PaymentTarget.paymentPointer(base + "/old")).getDestinationAddress());
    }

    @Test
    void resolvesInvoice() throws Exception {
        stubJson("/alice/invoices/123", invoiceJson(base + "/alice", "45601", "2302"));

        Destination destination = resolver.resolve(PaymentTarget.invoice(base + "/alice/invoices/123"));

        Invoice invoice = destination.getInvoice().orElseThrow();
        assertEquals(Amount.fromLong(45601), invoice.amountToDeliver);
        assertEquals(Amount.fromLong(2302), invoice.amountDelivered);
        assertEquals(Instant.parse("2030-01-01T00:00:00Z").toEpochMilli(), invoice.expiresAt);
        assertEquals("Coffee", invoice.description);
        assertEquals(new Asset("USD", 2), destination.getDestinationAsset().orElseThrow());
        assertEquals(base + "/alice", destination.getAccountUrl().orElseThrow());
        assertEquals("g.wallet.alice.inv123", destination.getDestinationAddress());
    }

    @Test
    void invoiceMustBelongToItsAccount() {
        stubJson("/alice/invoices/123", invoiceJson(base + "/bob", "45601", "2302"));
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.invoice(base + "/alice/invoices/123")));
    }

    @Test
    void invoiceAmountsMustBeU64Integers() {
        stubJson("/alice/invoices/123", invoiceJson(base + "/alice", "12.5", "0"));
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.invoice(base + "/alice/invoices/123")));

        stubJson("/alice/invoices/123", invoiceJson(base + "/alice", "18446744073709551616", "0"));
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.invoice(base + "/alice/invoices/123")));
    }

    @Test
    void incompleteInvoiceFails() {
        stubJson("/alice/invoices/123", "{\"id\":\"" + base + "/alice/invoices/123\",\"amount\":\"100\"}");
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.invoice(base + "/alice/invoices/123")));
    }

    @Test
    void insecureInvoiceUrlRejectedWithoutQuery() {
        resolver = new HttpDestinationResolver();
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.invoice(base + "/alice/invoices/123")));
        assertEquals(0, wm.getAllServeEvents().size());
    }

    @Test
    void httpErrorStatusFails() {
        wm.stubFor(get(urlEqualTo("/alice")).willReturn(aResponse().withStatus(404).withBody("not found")));

        PaymentException ex = assertThrows(PaymentException.class,
            () -> resolver.resolve(PaymentTarget.paymentPointer(base + "/alice")));
        assertEquals(PaymentError.QueryFailed, ex.getError());
        assertTrue(ex.getMessage().contains("HTTP 404"));
    }

    @Test
    void nonObjectOrMalformedBodyFails() {
        stubJson("/alice", "[]");
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.paymentPointer(base + "/alice")));

        stubJson("/alice", "not json");
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.paymentPointer(base + "/alice")));
    }

    @Test
    void badCredentialsInResponseFail() {
        stubJson("/alice", "{\"destination_account\":\"g.wallet.alice\",\"shared_secret\":\""
            + Base64.getEncoder().encodeToString(new byte[16]) + "\"}");
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.paymentPointer(base + "/alice")));

        stubJson("/alice", "{\"destination_account\":\"g.wallet.alice\",\"shared_secret\":\"!!not base64!!\"}");
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.paymentPointer(base + "/alice")));

        stubJson("/alice", "{\"destination_account\":\"not an address\",\"shared_secret\":\"" + SECRET_B64 + "\"}");
        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.paymentPointer(base + "/alice")));
    }

    @Test
    void slowServerTimesOut() {
        wm.stubFor(get(urlEqualTo("/alice"))
            .willReturn(aResponse()
                .withFixedDelay(2000)
                .withBody("{\"destination_account\":\"g.wallet.alice\",\"shared_secret\":\"" + SECRET_B64 + "\"}")));

        assertEquals(PaymentError.QueryFailed, failure(PaymentTarget.paymentPointer(base + "/alice")));
    }

    @Test
    void malformedPointerFailsBeforeQuery() {
        assertEquals(PaymentError.InvalidPaymentPointer, failure(PaymentTarget.paymentPointer("$wallet.example/a?b=c")));
        assertEquals(0, wm.getAllServeEvents().size());
    }

    @Test
    void validatesRawCredentials() throws Exception {
        assertEquals(PaymentError.InvalidCredentials, failure(PaymentTarget.credentials("g", SECRET, null)));
        assertEquals(PaymentError.InvalidCredentials,
            failure(PaymentTarget.credentials("g.wallet.alice", new byte[31], null)));
        assertEquals(PaymentError.InvalidCredentials,
            failure(PaymentTarget.credentials("g.wallet.alice", SECRET, new Asset("USD", 300))));
        assertEquals(PaymentError.InvalidCredentials, failure(null));

        Destination first = resolver.resolve(PaymentTarget.credentials("g.wallet.alice", SECRET, new Asset("USD", 2)));
        Destination second = resolver.resolve(PaymentTarget.credentials("g.wallet.alice", SECRET, new Asset("USD", 2)));
        assertEquals(first, second);
        assertEquals(new Asset("USD", 2), first.getDestinationAsset().orElseThrow());
    }
}
