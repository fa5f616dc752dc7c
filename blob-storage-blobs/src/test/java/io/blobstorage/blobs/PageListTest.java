package io.blobstorage.blobs;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class PageListTest {

    private static PageList parse(String xml) throws Exception {
        return PageList.parse(xml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void emptyElementHasNoRanges() throws Exception {
        PageList list = parse("<?xml version=\"1.0\" encoding=\"utf-8\"?><PageList />");

        assertThat(list.pageRanges()).isEmpty();
        assertThat(list.clearRanges()).isEmpty();
    }

    @Test
    void emptyBodyHasNoRanges() throws Exception {
        PageList list = PageList.parse(new byte[0]);

        assertThat(list.pageRanges()).isEmpty();
        assertThat(list.clearRanges()).isEmpty();
    }

    @Test
    void onlyClearRanges() throws Exception {
        PageList list = parse("<PageList><ClearRange><Start>0</Start><End>1023</End></ClearRange></PageList>");

        assertThat(list.pageRanges()).isEmpty();
        assertThat(list.clearRanges()).containsExactly(new PageRange(0, 1024));
    }

    @Test
    void interleavedRangesKeepEveryRun() throws Exception {
        PageList list = parse("<PageList>"
                + "<PageRange><Start>0</Start><End>511</End></PageRange>"
                + "<PageRange><Start>1024</Start><End>1535</End></PageRange>"
                + "<ClearRange><Start>2048</Start><End>2559</End></ClearRange>"
                + "<PageRange><Start>4096</Start><End>4607</End></PageRange>"
                + "</PageList>");

        assertThat(list.pageRanges()).containsExactly(
                new PageRange(0, 512), new PageRange(1024, 512), new PageRange(4096, 512));
        assertThat(list.clearRanges()).containsExactly(new PageRange(2048, 512));
    }
}
