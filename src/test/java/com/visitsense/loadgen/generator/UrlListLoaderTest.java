package com.visitsense.loadgen.generator;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.visitsense.loadgen.config.ConfigurationException;
import com.visitsense.loadgen.core.PageUrl;

import static org.junit.Assert.*;

/**
 * Tests de la lecture de la liste d'URLs
 */
public class UrlListLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testParseSkipsCommentsAndBlankLines() {
        List<PageUrl> urls = UrlListLoader.parse(Arrays.asList(
            "# pages du site",
            "",
            "https://shop.example.com/",
            "   ",
            "https://shop.example.com/products\tProducts",
            "https://shop.example.com/about trailing words",
            "  # indented comment"
        ));

        assertEquals(3, urls.size());
        assertEquals("https://shop.example.com/", urls.get(0).getUrl());
        assertFalse(urls.get(0).hasTitle());
        assertEquals("Products", urls.get(1).getTitle());
        assertEquals("Only the first token is the URL", "https://shop.example.com/about", urls.get(2).getUrl());
    }

    @Test
    public void testLoadFile() throws IOException {
        File file = folder.newFile("urls.txt");
        Files.write(file.toPath(), Arrays.asList("https://a.example.com/", "https://a.example.com/b"),
            StandardCharsets.UTF_8);

        assertEquals(2, UrlListLoader.load(file.toPath()).size());
    }

    @Test(expected = ConfigurationException.class)
    public void testEmptyListRejected() throws IOException {
        File file = folder.newFile("empty.txt");
        Files.write(file.toPath(), Arrays.asList("# nothing here", ""), StandardCharsets.UTF_8);

        UrlListLoader.load(file.toPath());
    }
}
