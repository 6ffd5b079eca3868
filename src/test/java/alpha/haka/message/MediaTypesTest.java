package alpha.haka.message;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link MediaTypes}.
 */
class MediaTypesTest
{
    @ParameterizedTest
    @CsvSource({
        "index.html,    text/html",
        "old.htm,       text/html",
        "site.css,      text/css",
        "app.js,        application/javascript",
        "data.json,     application/json",
        "logo.png,      image/png",
        "photo.jpg,     image/jpeg",
        "photo.jpeg,    image/jpeg",
        "anim.gif,      image/gif",
        "icon.svg,      image/svg+xml",
        "doc.pdf,       application/pdf",
        "notes.txt,     application/octet-stream",
        "README,        application/octet-stream",
        "INDEX.HTML,    application/octet-stream",
        "archive.tar.gz, application/octet-stream"
    })
    void guess(String filename, String expected) {
        assertThat(MediaTypes.guess(filename)).isEqualTo(expected);
    }
    
    @ParameterizedTest
    @CsvSource({
        "dir.d/file,     application/octet-stream",
        "dir/page.html,  text/html"
    })
    void guess_uses_file_name_of_path(String path, String expected) {
        assertThat(MediaTypes.guess(Path.of(path))).isEqualTo(expected);
    }
}
