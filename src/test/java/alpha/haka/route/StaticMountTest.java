package alpha.haka.route;

import alpha.haka.message.Request;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static alpha.haka.HttpConstants.Method.GET;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests for {@link StaticMount}.
 */
class StaticMountTest
{
    final StaticMount testee = new StaticMount("static/", Path.of("public"));
    
    @Test
    void prefix_is_normalized() {
        assertThat(testee.urlPrefix()).isEqualTo("/static");
    }
    
    @Test
    void covers_prefix_and_children_only() {
        assertThat(testee.covers(get("/static"))).isTrue();
        assertThat(testee.covers(get("/static/a.css"))).isTrue();
        assertThat(testee.covers(get("/staticx/a.css"))).isFalse();
        assertThat(testee.covers(get("/other"))).isFalse();
    }
    
    @Test
    void root_prefix_covers_everything() {
        StaticMount root = new StaticMount("/", Path.of("public"));
        assertThat(root.covers(get("/"))).isTrue();
        assertThat(root.covers(get("/x/y"))).isTrue();
        assertThat(root.subPath(get("/x/y"))).isEqualTo("/x/y");
        assertThat(root.subPath(get("/"))).isEqualTo("/index.html");
    }
    
    @Test
    void subPath_strips_prefix() {
        assertThat(testee.subPath(get("/static/css/a.css"))).isEqualTo("/css/a.css");
    }
    
    @Test
    void subPath_of_bare_prefix_is_index() {
        assertThat(testee.subPath(get("/static"))).isEqualTo("/index.html");
        assertThat(testee.subPath(get("/static/"))).isEqualTo("/index.html");
    }
    
    private static Request get(String path) {
        return new Request(GET, path);
    }
}
