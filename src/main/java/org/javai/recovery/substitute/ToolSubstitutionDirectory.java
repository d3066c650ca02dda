package org.javai.recovery.substitute;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The read-only graph of substitute tools, ranked best first.
 *
 * <p>Substitution is not symmetric: listing B as an alternative to A says
 * nothing about A replacing B. Constraints remove alternatives by their declared
 * tags; if that would leave nothing, the unfiltered list is returned so a known
 * tool never runs out of options.
 */
public final class ToolSubstitutionDirectory {

    private final Map<String, List<String>> alternatives;
    private final Map<String, Set<ToolTag>> tags;

    public ToolSubstitutionDirectory() {
        this(defaultAlternatives(), defaultTags());
    }

    /**
     * Creates a directory over custom tables. Tool names are normalized to lower case.
     *
     * @param alternatives ranked substitutes per tool
     * @param tags declared traits per tool (tools without an entry carry no tags)
     */
    public ToolSubstitutionDirectory(Map<String, List<String>> alternatives, Map<String, Set<ToolTag>> tags) {
        Objects.requireNonNull(alternatives, "alternatives must not be null");
        Objects.requireNonNull(tags, "tags must not be null");
        Map<String, List<String>> alternativesCopy = new LinkedHashMap<>();
        alternatives.forEach((tool, list) -> alternativesCopy.put(normalize(tool),
                list.stream().map(ToolSubstitutionDirectory::normalize).collect(Collectors.toUnmodifiableList())));
        Map<String, Set<ToolTag>> tagsCopy = new LinkedHashMap<>();
        tags.forEach((tool, set) -> tagsCopy.put(normalize(tool),
                set.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(set))));
        this.alternatives = Collections.unmodifiableMap(alternativesCopy);
        this.tags = Collections.unmodifiableMap(tagsCopy);
    }

    /**
     * Ranks the substitutes for a tool under the given constraints.
     *
     * @param tool the failed tool
     * @param constraints requirements the substitute should meet (may be null or empty)
     * @return substitutes best first; empty only when the tool has none declared
     */
    public List<String> alternativesFor(String tool, Set<SubstitutionConstraint> constraints) {
        List<String> declared = alternatives.getOrDefault(normalize(tool), List.of());
        if (declared.isEmpty() || constraints == null || constraints.isEmpty()) {
            return declared;
        }
        List<String> filtered = declared.stream()
                .filter(alternative -> satisfiesAll(alternative, constraints))
                .collect(Collectors.toUnmodifiableList());
        return filtered.isEmpty() ? declared : filtered;
    }

    /**
     * The best substitute for a tool, if it has any.
     */
    public Optional<String> bestAlternative(String tool, Set<SubstitutionConstraint> constraints) {
        List<String> ranked = alternativesFor(tool, constraints);
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0));
    }

    public Set<ToolTag> tagsOf(String tool) {
        return tags.getOrDefault(normalize(tool), Set.of());
    }

    public boolean knows(String tool) {
        return alternatives.containsKey(normalize(tool));
    }

    private boolean satisfiesAll(String alternative, Set<SubstitutionConstraint> constraints) {
        Set<ToolTag> declaredTags = tagsOf(alternative);
        return constraints.stream().noneMatch(c -> declaredTags.contains(c.excludedTag()));
    }

    private static String normalize(String tool) {
        return tool == null ? "" : tool.trim().toLowerCase(Locale.ROOT);
    }

    // === Default tables ===

    static Map<String, List<String>> defaultAlternatives() {
        Map<String, List<String>> table = new LinkedHashMap<>();

        // Network scanning
        table.put("nmap", List.of("rustscan", "masscan", "zmap"));
        table.put("rustscan", List.of("nmap", "masscan"));
        table.put("masscan", List.of("nmap", "rustscan", "zmap"));

        // Directory and file discovery
        table.put("gobuster", List.of("feroxbuster", "dirsearch", "ffuf", "dirb"));
        table.put("feroxbuster", List.of("gobuster", "dirsearch", "ffuf"));
        table.put("dirsearch", List.of("gobuster", "feroxbuster", "ffuf"));
        table.put("ffuf", List.of("gobuster", "feroxbuster", "dirsearch"));

        // Vulnerability scanning
        table.put("nuclei", List.of("jaeles", "nikto", "w3af"));
        table.put("jaeles", List.of("nuclei", "nikto"));
        table.put("nikto", List.of("nuclei", "jaeles", "w3af"));

        // Web crawling
        table.put("katana", List.of("gau", "waybackurls", "hakrawler"));
        table.put("gau", List.of("katana", "waybackurls", "hakrawler"));
        table.put("waybackurls", List.of("gau", "katana", "hakrawler"));

        // Parameter discovery
        table.put("arjun", List.of("paramspider", "x8", "ffuf"));
        table.put("paramspider", List.of("arjun", "x8"));
        table.put("x8", List.of("arjun", "paramspider"));

        // Injection testing
        table.put("sqlmap", List.of("sqlninja", "jsql-injection"));
        table.put("dalfox", List.of("xsser", "xsstrike"));

        // Subdomain enumeration
        table.put("subfinder", List.of("amass", "assetfinder", "findomain"));
        table.put("amass", List.of("subfinder", "assetfinder", "findomain"));
        table.put("assetfinder", List.of("subfinder", "amass", "findomain"));

        // Cloud and container security
        table.put("prowler", List.of("scout-suite", "cloudmapper"));
        table.put("scout-suite", List.of("prowler", "cloudmapper"));
        table.put("trivy", List.of("clair", "docker-bench-security"));
        table.put("clair", List.of("trivy", "docker-bench-security"));

        // Binary analysis and exploitation
        table.put("ghidra", List.of("radare2", "ida", "binary-ninja"));
        table.put("radare2", List.of("ghidra", "objdump", "gdb"));
        table.put("gdb", List.of("radare2", "lldb"));
        table.put("pwntools", List.of("ropper", "ropgadget"));
        table.put("ropper", List.of("ropgadget", "pwntools"));
        table.put("ropgadget", List.of("ropper", "pwntools"));

        return table;
    }

    static Map<String, Set<ToolTag>> defaultTags() {
        Map<String, Set<ToolTag>> table = new LinkedHashMap<>();
        table.put("nmap", EnumSet.of(ToolTag.REQUIRES_PRIVILEGES));
        table.put("masscan", EnumSet.of(ToolTag.REQUIRES_PRIVILEGES));
        table.put("zmap", EnumSet.of(ToolTag.REQUIRES_PRIVILEGES));
        table.put("amass", EnumSet.of(ToolTag.SLOW));
        table.put("w3af", EnumSet.of(ToolTag.SLOW));
        return table;
    }
}
