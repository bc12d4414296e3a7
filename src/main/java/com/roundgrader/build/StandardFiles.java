package com.roundgrader.build;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Year;
import java.util.List;

/**
 * License and readme appended to every published application.
 */
public final class StandardFiles {
    public static final String LICENSE = "LICENSE";
    public static final String README = "README.md";

    private StandardFiles() {}

    public static String mitLicense(Year year) {
        return "MIT License\n\n"
                + "Copyright (c) " + year + "\n\n"
                + "Permission is hereby granted, free of charge, to any person obtaining a copy\n"
                + "of this software and associated documentation files (the \"Software\"), to deal\n"
                + "in the Software without restriction, including without limitation the rights\n"
                + "to use, copy, modify, merge, publish, distribute, sublicense, and/or sell\n"
                + "copies of the Software, and to permit persons to whom the Software is\n"
                + "furnished to do so, subject to the following conditions:\n\n"
                + "The above copyright notice and this permission notice shall be included in all\n"
                + "copies or substantial portions of the Software.\n\n"
                + "THE SOFTWARE IS PROVIDED \"AS IS\", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR\n"
                + "IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,\n"
                + "FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE\n"
                + "AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER\n"
                + "LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,\n"
                + "OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE\n"
                + "SOFTWARE.\n";
    }

    public static String readme(String taskId, String brief, List<JsonNode> checks) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(taskId).append("\n\n");
        sb.append("## Overview\n\n").append(brief.trim()).append("\n\n");
        sb.append("## Features\n\n");
        for (JsonNode check : checks) {
            sb.append("- ").append(describe(check)).append('\n');
        }
        sb.append("\n## Quick Start\n\n");
        sb.append("Open `index.html` in a browser, or visit the published page.\n\n");
        sb.append("## Usage\n\n");
        sb.append("The application runs entirely in the browser and needs no build step.\n\n");
        sb.append("## Project Structure\n\n");
        sb.append("```\n").append("index.html\n").append(LICENSE).append('\n').append(README).append("\n```\n\n");
        sb.append("## License\n\nMIT\n");
        return sb.toString();
    }

    private static String describe(JsonNode check) {
        if (check.isTextual()) {
            return check.asText();
        }
        String type = check.path("type").asText("check");
        JsonNode selector = check.get("selector");
        return selector != null ? type + " (" + selector.asText() + ")" : type;
    }
}
