package io.blobstorage.blobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binding for the {@code <PageList>} document returned by {@code comp=pagelist}.
 *
 * <pre>{@code
 * <PageList>
 *   <PageRange><Start>0</Start><End>511</End></PageRange>
 *   <ClearRange><Start>512</Start><End>1023</End></ClearRange>
 * </PageList>
 * }</pre>
 *
 * <p>Range elements may be interleaved; the setters append so that every run is kept.
 */
@JacksonXmlRootElement(localName = "PageList")
@JsonIgnoreProperties(ignoreUnknown = true)
final class PageList {

    private static final XmlMapper XML = new XmlMapper();

    private final List<PageRange> pageRanges = new ArrayList<>();
    private final List<PageRange> clearRanges = new ArrayList<>();

    static PageList parse(byte[] xml) throws IOException {
        if (xml.length == 0) {
            return new PageList();
        }
        PageList parsed = XML.readValue(xml, PageList.class);
        return parsed == null ? new PageList() : parsed;
    }

    @JsonSetter("PageRange")
    @JacksonXmlElementWrapper(useWrapping = false)
    void addPageRanges(List<Range> ranges) {
        if (ranges != null) ranges.forEach(r -> pageRanges.add(r.toPageRange()));
    }

    @JsonSetter("ClearRange")
    @JacksonXmlElementWrapper(useWrapping = false)
    void addClearRanges(List<Range> ranges) {
        if (ranges != null) ranges.forEach(r -> clearRanges.add(r.toPageRange()));
    }

    List<PageRange> pageRanges() {
        return pageRanges;
    }

    List<PageRange> clearRanges() {
        return clearRanges;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Range {
        @JacksonXmlProperty(localName = "Start")
        public long start;

        @JacksonXmlProperty(localName = "End")
        public long end;

        PageRange toPageRange() {
            return new PageRange(start, end - start + 1);
        }
    }
}
