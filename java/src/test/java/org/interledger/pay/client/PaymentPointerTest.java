package org.interledger.pay.client;

import org.interledger.pay.PaymentError;
import org.interledger.pay.PaymentException;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class PaymentPointerTest {

    private static void assertInvalid(String pointer, boolean allowInsecure) {
        PaymentException ex = assertThrows(PaymentException.class, () -> PaymentPointer.toUrl(pointer, allowInsecure));
        assertEquals(PaymentError.InvalidPaymentPointer, ex.getError());
    }

    @Test
    void expandsDollarPrefix() throws PaymentException {
        assertEquals(URI.create("https://wallet.example/alice"), PaymentPointer.toUrl("$wallet.example/alice", false));
        assertEquals(URI.create("https://wallet.example:8443/alice/usd"),
                PaymentPointer.toUrl("$wallet.example:8443/alice/usd", false));
    }

    @Test
    void emptyPathUsesWellKnownLocation() throws PaymentException {
        assertEquals(URI.create("https://wallet.example/.well-known/pay"), PaymentPointer.toUrl("$wallet.example", false));
        assertEquals(URI.create("https://wallet.example/.well-known/pay"), PaymentPointer.toUrl("$wallet.example/", false));
        assertEquals(URI.create("https://wallet.example/.well-known/pay"),
                PaymentPointer.toUrl("https://wallet.example", false));
    }

    @Test
    void rejectsMalformedPointers() {
        assertInvalid(null, false);
        assertInvalid("", false);
        assertInvalid("$", false);
        assertInvalid("ht$tps://wallet.example/alice", false);
        assertInvalid("$wallet.example/alice?invoice=1", false);
        assertInvalid("$wallet.example/alice#frag", false);
        assertInvalid("https://user@wallet.example/alice", false);
        assertInvalid("ftp://wallet.example/alice", false);
    }

    @Test
    void plainHttpOnlyWhenAllowed() throws PaymentException {
        assertInvalid("http://wallet.example/alice", false);
        assertEquals(URI.create("http://localhost:8080/alice"), PaymentPointer.toUrl("http://localhost:8080/alice", true));
    }
}
