package io.blobstorage.core;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseTest {

    @Test
    void statusLineNeverChanges() throws Exception {
        Response response = new Response(404, "The specified blob does not exist.");
        response.addHeaderLine("x-ms-error-code: BlobNotFound\r");
        response.addHeader("x-ms-request-id", "r1");
        response.setBodyStream(MemoryBodyStream.of("<Error/>"));
        response.readBody(Context.none());

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.reasonPhrase()).isEqualTo("The specified blob does not exist.");
        assertThat(response.isSuccess()).isFalse();
    }

    @Test
    void headersAreReadOnlyForCallers() {
        Response response = new Response(200, "OK");
        response.addHeaderLine("ETag: \"0x1\"\r");
        response.addHeaderLine("\r");

        assertThat(response.headers().firstValue("etag")).contains("\"0x1\"");
        assertThat(response.headers().size()).isEqualTo(1);
        assertThatThrownBy(() -> response.headers().add("ETag", "x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullReasonBecomesEmpty() {
        assertThat(new Response(204, null).reasonPhrase()).isEmpty();
    }

    @Test
    void rejectsImpossibleStatusCodes() {
        assertThatThrownBy(() -> new Response(42, "?")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replacingTheBodyClosesThePreviousOne() throws Exception {
        Response response = new Response(200, "OK");
        MemoryBodyStream first = MemoryBodyStream.of("first");
        MemoryBodyStream second = MemoryBodyStream.of("second");

        response.setBodyStream(first);
        response.setBodyStream(second);

        assertThat(first.isClosed()).isTrue();
        assertThat(response.bodyStream()).isSameAs(second);
    }

    @Test
    void bodyCanBeTakenExactlyOnce() throws Exception {
        Response response = new Response(200, "OK");
        MemoryBodyStream body = MemoryBodyStream.of("data");
        response.setBodyStream(body);

        assertThat(response.takeBodyStream()).isSameAs(body);
        assertThat(response.bodyStream()).isNull();
        assertThatThrownBy(response::takeBodyStream).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closingTheResponseDoesNotTouchATakenBody() throws Exception {
        Response response = new Response(200, "OK");
        MemoryBodyStream body = MemoryBodyStream.of("data");
        response.setBodyStream(body);

        BodyStream taken = response.takeBodyStream();
        response.close();

        assertThat(taken.isClosed()).isFalse();
        assertThat(new String(taken.readToEnd(Context.none()))).isEqualTo("data");
    }

    @Test
    void closeReleasesAnOwnedBody() throws Exception {
        AtomicInteger closes = new AtomicInteger();
        Response response = new Response(200, "OK");
        response.setBodyStream(new InputStreamBodyStream(new ByteArrayInputStream(new byte[3]), 3, closes::incrementAndGet));

        response.close();
        response.close();

        assertThat(closes).hasValue(1);
    }

    @Test
    void readBodyOfBodilessResponseIsEmpty() throws Exception {
        assertThat(new Response(204, "No Content").readBody(Context.none())).isEmpty();
    }

    @Test
    void reasonPhrasesCoverCommonCodes() {
        assertThat(ReasonPhrases.of(206)).isEqualTo("Partial Content");
        assertThat(ReasonPhrases.of(599)).isEmpty();
    }
}
