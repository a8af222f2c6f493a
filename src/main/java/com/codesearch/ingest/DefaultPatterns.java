package com.codesearch.ingest;

import java.util.List;

public final class DefaultPatterns {
    public static final List<String> INCLUDE = List.of(
            "*.php", "*.phtml", "*.php3", "*.php4", "*.php5", "*.php7", "*.php8",
            "*.py", "*.pyw", "*.pyi", "*.pyc", "*.pyo",
            "*.js", "*.jsx", "*.mjs", "*.cjs",
            "*.ts", "*.tsx", "*.mts", "*.cts",
            "*.java", "*.jav", "*.jsp", "*.jspx",
            "*.cpp", "*.cxx", "*.cc", "*.c++", "*.hpp", "*.hxx", "*.h++",
            "*.c", "*.h",
            "*.cs", "*.csx",
            "*.go", "*.gox",
            "*.rs", "*.rlib",
            "*.rb", "*.rbw", "*.rake", "*.gemspec",
            "*.swift", "*.swiftinterface",
            "*.kt", "*.kts",
            "*.scala", "*.sc",
            "*.clj", "*.cljs", "*.cljc", "*.edn",
            "*.hs", "*.lhs",
            "*.ml", "*.mli", "*.fs", "*.fsi", "*.fsx", "*.fsscript",
            "*.erl", "*.hrl", "*.ex", "*.exs",
            "*.lua", "*.luac",
            "*.r", "*.R", "*.Rmd", "*.rmd",
            "*.m", "*.mm", "*.M",
            "*.pl", "*.pm", "*.t", "*.pod",
            "*.sh", "*.bash", "*.zsh", "*.fish", "*.ps1", "*.psm1", "*.psd1",
            "*.sql", "*.psql", "*.mysql", "*.sqlite",
            "*.html", "*.htm", "*.xhtml", "*.xml", "*.svg", "*.vue", "*.svelte",
            "*.css", "*.scss", "*.sass", "*.less", "*.styl",
            "*.md", "*.markdown", "*.mdown", "*.mkdn", "*.mdx",
            "*.txt", "*.text", "*.rtf",
            "*.yml", "*.yaml", "*.json", "*.jsonc", "*.json5",
            "*.toml", "*.ini", "*.cfg", "*.conf", "*.config",
            "*.dockerfile", "*.Dockerfile",
            "*.tf", "*.tfvars",
            "*.proto", "*.thrift", "*.graphql", "*.gql",
            "*.asm", "*.s", "*.S",
            "*.dart", "*.dartx",
            "*.elm",
            "*.nim", "*.nims",
            "*.zig",
            "*.v", "*.vh", "*.sv", "*.svh",
            "*.tex", "*.ltx", "*.sty",
            "*.rst", "*.rest",
            "*.adoc", "*.asciidoc",
            "*.org", "*.org_archive");

    public static final List<String> EXCLUDE = List.of(
            "node_modules", "node_modules/**",
            ".git", ".git/**",
            "dist", "dist/**",
            "build", "build/**",
            "out", "out/**",
            "coverage", "coverage/**",
            "__pycache__", "__pycache__/**",
            "venv", "venv/**", ".venv", ".venv/**",
            ".next", ".next/**",
            "target", "target/**",
            ".cache", ".cache/**",
            "*.log", "*.tmp");

    private DefaultPatterns() {
    }
}
