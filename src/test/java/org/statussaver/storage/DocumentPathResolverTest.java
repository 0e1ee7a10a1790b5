package org.statussaver.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentPathResolverTest {

    @TempDir
    Path temp;

    private Path primary;
    private Path sdcard;
    private StorageAccessProperties properties;

    @BeforeEach
    void setUp() throws IOException {
        primary = Files.createDirectories(temp.resolve("primary"));
        sdcard = Files.createDirectories(primary.resolve("mnt/sdcard"));
        properties = new StorageAccessProperties();
        Map<String, String> roots = new LinkedHashMap<>();
        roots.put("primary", primary.toString());
        roots.put("sdcard", sdcard.toString());
        properties.setRoots(roots);
    }

    @Test
    void resolve_mapsDocumentIdIntoVolume() {
        DocumentPathResolver resolver = new DocumentPathResolver(properties);

        assertThat(resolver.resolve("primary:")).isEqualTo(primary.toAbsolutePath().normalize());
        assertThat(resolver.resolve("primary:DCIM/Camera")).isEqualTo(primary.resolve("DCIM/Camera").toAbsolutePath().normalize());
    }

    @Test
    void resolve_rejectsTraversalAndUnknownVolumes() {
        DocumentPathResolver resolver = new DocumentPathResolver(properties);

        assertThatThrownBy(() -> resolver.resolve("primary:../outside")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve("usb:data")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> resolver.resolve("no-colon")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolve_rejectsSymlinkByDefault() throws IOException {
        Path outside = Files.createDirectories(temp.resolve("outside"));
        Files.createSymbolicLink(primary.resolve("link"), outside);
        DocumentPathResolver resolver = new DocumentPathResolver(properties);

        assertThatThrownBy(() -> resolver.resolve("primary:link")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toDocumentId_prefersInnermostVolume() throws IOException {
        Path statuses = Files.createDirectories(sdcard.resolve("WhatsApp/.Statuses"));
        Path dcim = Files.createDirectories(primary.resolve("DCIM"));
        DocumentPathResolver resolver = new DocumentPathResolver(properties);

        assertThat(resolver.toDocumentId(statuses)).contains("sdcard:WhatsApp/.Statuses");
        assertThat(resolver.toDocumentId(dcim)).contains("primary:DCIM");
        assertThat(resolver.toDocumentId(primary)).contains("primary:");
        assertThat(resolver.toDocumentId(temp)).isEmpty();
        assertThat(resolver.toDocumentId(null)).isEmpty();
    }

    @Test
    void childDocumentId_joinsWithSlashExceptAtVolumeRoot() {
        assertThat(DocumentPathResolver.childDocumentId("primary:", "a.jpg")).isEqualTo("primary:a.jpg");
        assertThat(DocumentPathResolver.childDocumentId("primary:DCIM", "a.jpg")).isEqualTo("primary:DCIM/a.jpg");
    }
}
