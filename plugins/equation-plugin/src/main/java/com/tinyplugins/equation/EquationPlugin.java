package com.tinyplugins.equation;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.tinyeditor.api.EditorPlugin;
import com.tinyeditor.common.auth.User;
import com.tinyeditor.common.model.SettingEntry;
import com.tinyeditor.core.Kernel;
import com.tinyeditor.core.config.ConfigStore;
import com.tinyeditor.core.config.Configuration;
import com.tinyeditor.core.context.EditorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Equation editor. Ships the TeX symbol library groups as one JSON encoded value.
 */
public class EquationPlugin implements EditorPlugin {
    private static final Logger logger = LoggerFactory.getLogger(EquationPlugin.class);

    public static final String NAMESPACE = "tiny_equation";
    static final String DOCS_PAGE = "Using_TeX_Notation";

    private static final String[] GROUP_NAMES = { "Operators", "Arrows", "Greek symbols", "Advanced" };
    private static final String[] GROUP_DEFAULTS = {
            String.join("\n",
                    "\\cdot", "\\times", "\\ast", "\\div", "\\diamond", "\\pm", "\\mp", "\\oplus",
                    "\\ominus", "\\otimes", "\\oslash", "\\odot", "\\circ", "\\bullet", "\\asymp",
                    "\\equiv", "\\subseteq", "\\supseteq", "\\leq", "\\geq", "\\preceq", "\\succeq",
                    "\\sim", "\\simeq", "\\approx", "\\subset", "\\supset", "\\ll", "\\gg", "\\prec",
                    "\\succ", "\\infty", "\\in", "\\ni", "\\forall", "\\exists", "\\neq"),
            String.join("\n",
                    "\\leftarrow", "\\rightarrow", "\\uparrow", "\\downarrow", "\\leftrightarrow",
                    "\\nearrow", "\\searrow", "\\swarrow", "\\nwarrow", "\\Leftarrow", "\\Rightarrow",
                    "\\Uparrow", "\\Downarrow", "\\Leftrightarrow"),
            String.join("\n",
                    "\\alpha", "\\beta", "\\gamma", "\\delta", "\\epsilon", "\\zeta", "\\eta", "\\theta",
                    "\\iota", "\\kappa", "\\lambda", "\\mu", "\\nu", "\\xi", "\\pi", "\\rho", "\\sigma",
                    "\\tau", "\\upsilon", "\\phi", "\\chi", "\\psi", "\\omega", "\\Gamma", "\\Delta",
                    "\\Theta", "\\Lambda", "\\Xi", "\\Pi", "\\Sigma", "\\Upsilon", "\\Phi", "\\Psi",
                    "\\Omega"),
            String.join("\n",
                    "\\sum{a,b}", "\\sqrt[a]{b+c}", "\\int_{a}^{b}{c}", "\\iint_{a}^{b}{c}",
                    "\\iiint_{a}^{b}{c}", "\\oint{a}", "(a)", "[a]", "\\lbrace{a}\\rbrace",
                    "\\left| \\begin{matrix} a_1 & a_2 \\\\ a_3 & a_4 \\end{matrix} \\right|",
                    "\\frac{a}{b+c}", "\\vec{a}", "\\binom {a} {b}", "{a \\brack b}", "{a \\brace b}")
    };

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
    private ConfigStore config;

    /**
     * One symbol group of the editor dialog. "active" is only sent for the group
     * opened first.
     */
    static class LibraryGroup {
        final String key;
        final String groupname;
        final List<String> elements;
        final Boolean active;

        LibraryGroup(String key, String groupname, List<String> elements, Boolean active) {
            this.key = key;
            this.groupname = groupname;
            this.elements = elements;
            this.active = active;
        }
    }

    @Override
    public String getName() {
        return "equation";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        Configuration configuration = kernel.getConfigManager().getConfig();
        for (int i = 0; i < GROUP_DEFAULTS.length; i++) {
            configuration.setDefaultPluginSetting(NAMESPACE, "librarygroup" + (i + 1), GROUP_DEFAULTS[i]);
        }
        this.config = kernel.getConfigManager();
        logger.info("Equation plugin enabled (v{})", getVersion());
    }

    @Override
    public List<SettingEntry> buildSettings(EditorContext context, User user) {
        List<SettingEntry> settings = new ArrayList<>();
        settings.add(SettingEntry.of("texfilter", "1".equals(config.get("filter_tex", "active"))));
        settings.add(new SettingEntry("libraries", gson.toJson(getLibraries())));
        settings.add(new SettingEntry("texdocsurl", getDocsUrl()));
        return settings;
    }

    List<LibraryGroup> getLibraries() {
        List<LibraryGroup> groups = new ArrayList<>();
        for (int i = 0; i < GROUP_NAMES.length; i++) {
            String key = "group" + (i + 1);
            String raw = config.get(NAMESPACE, "library" + key, GROUP_DEFAULTS[i]);
            groups.add(new LibraryGroup(key, GROUP_NAMES[i], splitElements(raw), i == 0 ? Boolean.TRUE : null));
        }
        return groups;
    }

    static List<String> splitElements(String raw) {
        return Arrays.asList(raw.trim().split("\n", -1));
    }

    String getDocsUrl() {
        String root = config.get(Configuration.CORE_NAMESPACE, "docroot", "https://docs.moodle.org");
        String version = config.get(Configuration.CORE_NAMESPACE, "docsversion", "500");
        String lang = config.get(Configuration.CORE_NAMESPACE, "lang", "en");
        return root + "/" + version + "/" + lang + "/" + DOCS_PAGE;
    }
}
