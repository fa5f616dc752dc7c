package io.blobstorage.http;

import io.blobstorage.core.BodyStream;
import io.blobstorage.core.InputStreamBodyStream;
import io.blobstorage.core.LimitedBodyStream;
import io.blobstorage.core.MemoryBodyStream;
import io.blobstorage.core.Response;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads one HTTP/1.1 response off a raw byte stream.
 *
 * <p>The status line is parsed into the {@link Response}; each following line is
 * handed to {@link Response#addHeaderLine(String)} with its {@code \n} removed and any
 * {@code \r} left in place. The header block ends at the first empty line. The body is
 * framed by {@code Content-Length} when present and otherwise runs until the source ends.
 * Chunked transfer coding is not supported.
 */
public final class Http1ResponseReader {

    private static final int HEADER_LIMIT = 256 * 1024;

    private final InputStream in;
    private long headerLimit = HEADER_LIMIT;

    public Http1ResponseReader(InputStream in) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
    }

    /**
     * Parses status line and headers and attaches the body. The source stream becomes
     * owned by the returned response.
     *
     * @throws IOException on a malformed status line, an oversized header block, an
     *         unsupported transfer coding, or a source that ends inside the header block
     */
    public Response read() throws IOException {
        String statusLine = stripCarriageReturn(readLine());
        Response response = parseStatusLine(statusLine);

        while (true) {
            String line = readLine();
            if (line.isEmpty() || line.equals("\r")) break;
            response.addHeaderLine(line);
        }

        response.setBodyStream(bodyFor(response));
        return response;
    }

    /**
     * Convenience for {@code new Http1ResponseReader(in).read()}.
     */
    public static Response read(InputStream in) throws IOException {
        return new Http1ResponseReader(in).read();
    }

    static Response parseStatusLine(String line) throws IOException {
        if (!line.startsWith("HTTP/")) {
            throw new IOException("Unexpected status line: " + line);
        }
        int firstSpace = line.indexOf(' ');
        if (firstSpace < 0 || line.length() < firstSpace + 4) {
            throw new IOException("Unexpected status line: " + line);
        }
        int code;
        try {
            code = Integer.parseInt(line.substring(firstSpace + 1, firstSpace + 4));
        } catch (NumberFormatException e) {
            throw new IOException("Unexpected status line: " + line, e);
        }
        String reason = "";
        if (line.length() > firstSpace + 4) {
            if (line.charAt(firstSpace + 4) != ' ') {
                throw new IOException("Unexpected status line: " + line);
            }
            reason = line.substring(firstSpace + 5);
        }
        if (code < 100) {
            throw new IOException("Unexpected status line: " + line);
        }
        return new Response(code, reason);
    }

    private BodyStream bodyFor(Response response) throws IOException {
        int code = response.statusCode();
        if (code < 200 || code == 204 || code == 304) {
            return MemoryBodyStream.empty();
        }

        Optional<String> transferEncoding = response.headers().firstValue("Transfer-Encoding");
        if (transferEncoding.isPresent()
                && transferEncoding.get().toLowerCase(Locale.ROOT).contains("chunked")) {
            throw new IOException("Unsupported transfer coding: " + transferEncoding.get());
        }

        Optional<String> contentLength = response.headers().firstValue("Content-Length");
        if (contentLength.isPresent()) {
            long length;
            try {
                length = Long.parseLong(contentLength.get().trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid Content-Length: " + contentLength.get(), e);
            }
            if (length < 0) {
                throw new IOException("Invalid Content-Length: " + contentLength.get());
            }
            return new LimitedBodyStream(new InputStreamBodyStream(in), length);
        }
        return new InputStreamBodyStream(in);
    }

    /** Reads up to and excluding the next {@code \n}, counted against the header size limit. */
    private String readLine() throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(64);
        int b;
        while ((b = in.read()) != '\n') {
            if (b < 0) {
                throw new EOFException("Stream ended inside the header block");
            }
            if (--headerLimit < 0) {
                throw new IOException("Header block exceeds " + HEADER_LIMIT + " bytes");
            }
            line.write(b);
        }
        return line.toString(StandardCharsets.ISO_8859_1);
    }

    private static String stripCarriageReturn(String s) {
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }
}
