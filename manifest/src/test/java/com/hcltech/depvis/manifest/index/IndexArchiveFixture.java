package com.hcltech.depvis.manifest.index;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds gzip-compressed tar archives in memory. */
public final class IndexArchiveFixture {

    public static byte[] archive(Map<String, String> members) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(bytes))) {
            for (Map.Entry<String, String> m : members.entrySet()) {
                byte[] content = m.getValue().getBytes(StandardCharsets.UTF_8);
                TarArchiveEntry entry = new TarArchiveEntry(m.getKey());
                entry.setSize(content.length);
                tar.putArchiveEntry(entry);
                tar.write(content);
                tar.closeArchiveEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    public static byte[] index(String control) {
        Map<String, String> members = new LinkedHashMap<>();
        members.put("DESCRIPTION", "test repository\n");
        members.put(PackageIndexParser.CONTROL_MEMBER, control);
        return archive(members);
    }

    /** A gzip stream holding one tar member and no end-of-archive blocks, the way signed indexes start. */
    public static byte[] unterminated(String name, String content) {
        byte[] data = content.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(raw)) {
            TarArchiveEntry entry = new TarArchiveEntry(name);
            entry.setSize(data.length);
            tar.putArchiveEntry(entry);
            tar.write(data);
            tar.closeArchiveEntry();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        int blocks = 1 + (data.length + 511) / 512;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GzipCompressorOutputStream gz = new GzipCompressorOutputStream(bytes)) {
            gz.write(raw.toByteArray(), 0, blocks * 512);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    public static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    public static final String SAMPLE = String.join("\n",
            "C:Q1abc=",
            "P:busybox",
            "V:1.36.1-r15",
            "D:so:libc.musl-x86_64.so.1",
            "",
            "P:curl",
            "V:8.5.0-r0",
            "D:ca-certificates-bundle libcurl=8.5.0-r0 so:libc.musl-x86_64.so.1",
            "",
            "P:libcurl",
            "V:8.5.0-r0",
            "",
            "V:0.0.1",
            "D:orphan",
            "");

    private IndexArchiveFixture() {}
}
