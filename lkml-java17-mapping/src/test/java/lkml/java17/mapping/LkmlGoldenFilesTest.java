package lkml.java17.mapping;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/// Renders each `golden/<name>.json` mapping and compares it with `golden/<name>.lkml`.
class LkmlGoldenFilesTest extends LkmlMappingLoggingConfig {

    private static final Logger LOG = Logger.getLogger(LkmlGoldenFilesTest.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static List<String> goldenNames() {
        try {
            URL dirUrl = Objects.requireNonNull(LkmlGoldenFilesTest.class.getClassLoader().getResource("golden"),
                    "missing golden directory");
            try (Stream<Path> s = Files.list(Path.of(dirUrl.toURI()))) {
                return s.map(p -> p.getFileName().toString())
                        .filter(name -> name.endsWith(".json"))
                        .map(name -> name.substring(0, name.length() - ".json".length()))
                        .sorted(Comparator.naturalOrder())
                        .toList();
            }
        } catch (URISyntaxException | IOException e) {
            throw new RuntimeException("Failed to list golden files", e);
        }
    }

    private static Path resource(String resourcePath) {
        try {
            URL url = Objects.requireNonNull(LkmlGoldenFilesTest.class.getClassLoader().getResource(resourcePath),
                    resourcePath);
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new RuntimeException("Failed to resolve resource: " + resourcePath, e);
        }
    }

    private static Map<String, Object> readMapping(String name) throws IOException {
        return MAPPER.readValue(resource("golden/" + name + ".json").toFile(),
                new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("goldenNames")
    void rendersExpectedText(String name) throws IOException {
        LOG.info(() -> "TEST: rendersExpectedText " + name);

        final var mapping = readMapping(name);
        final var expected = Files.readString(resource("golden/" + name + ".lkml"), StandardCharsets.UTF_8);

        assertThat(Lkml.render(Lkml.build(mapping))).isEqualTo(expected.stripTrailing());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("goldenNames")
    void visitRecoversTheMapping(String name) throws IOException {
        LOG.info(() -> "TEST: visitRecoversTheMapping " + name);

        final var mapping = readMapping(name);
        final var tree = Lkml.build(mapping);

        assertThat(Lkml.visit(tree)).isEqualTo(mapping);
        assertThat(Lkml.render(Lkml.build(Lkml.visit(tree)))).isEqualTo(Lkml.render(tree));
    }
}
