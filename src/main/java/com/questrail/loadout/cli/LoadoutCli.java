package com.questrail.loadout.cli;

import com.questrail.loadout.api.DecodedLoadout;
import com.questrail.loadout.api.NodeSelection;
import com.questrail.loadout.api.Section;
import com.questrail.loadout.api.TreeNode;
import com.questrail.loadout.catalog.CatalogFormatException;
import com.questrail.loadout.catalog.JsonNodeCatalogReader;
import com.questrail.loadout.catalog.NodeCatalog;
import com.questrail.loadout.catalog.SelectionPartition;
import com.questrail.loadout.codec.LoadoutDecodeException;
import com.questrail.loadout.codec.LoadoutDecoder;
import com.questrail.loadout.codec.LoadoutEncoder;
import com.questrail.loadout.codec.impl.DefaultLoadoutDecoder;
import com.questrail.loadout.codec.impl.DefaultLoadoutEncoder;
import com.questrail.loadout.fingerprint.SelectionFingerprint;
import com.questrail.loadout.observability.LoadoutObservabilitySink;
import com.questrail.loadout.observability.Slf4jLoadoutObservabilitySink;
import com.questrail.loadout.overrides.LoadoutDirective;
import com.questrail.loadout.overrides.LoadoutModifier;
import com.questrail.loadout.overrides.LoadoutOverrides;
import com.questrail.loadout.overrides.ModifyResult;
import com.questrail.loadout.overrides.OverrideResolver;
import com.questrail.loadout.overrides.UnknownNodeException;
import com.questrail.loadout.validation.LoadoutValidator;
import com.questrail.loadout.validation.SectionBudgets;
import com.questrail.loadout.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line front end: decode, encode, validate, modify and fingerprint
 * loadout strings against a JSON node catalog.
 *
 * <p>Produced loadout strings go to standard out; diagnostics and log output
 * go to standard error.</p>
 */
@Command(
    name = "loadout",
    mixinStandardHelpOptions = true,
    version = "loadout 0.1.0",
    description = {
        "Encodes, decodes and validates talent loadout strings.",
        "",
        "Every command needs the node catalog the strings are encoded against:",
        "  @|bold loadout --catalog|@ @|fg(yellow) FILE|@ COMMAND ...",
        "",
    },
    subcommands = {
        HelpCommand.class,
        Decode.class,
        Encode.class,
        Validate.class,
        Modify.class,
        Fingerprint.class,
    })
public class LoadoutCli
{
    private static final Logger log = LoggerFactory.getLogger(LoadoutCli.class);

    static final LoadoutDecoder DECODER = new DefaultLoadoutDecoder();
    static final LoadoutEncoder ENCODER = new DefaultLoadoutEncoder();

    @Spec
    private CommandSpec spec;

    @Option(
        names = "--catalog",
        paramLabel = "FILE",
        description = "JSON node catalog (array of node objects)")
    private Path catalogFile;

    @Option(
        names = "--primary-budget",
        paramLabel = "POINTS",
        description = "Points the primary section must spend (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SectionBudgets.DEFAULT_PRIMARY)
    private int primaryBudget;

    @Option(
        names = "--specialization-budget",
        paramLabel = "POINTS",
        description = "Points the specialization section must spend (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SectionBudgets.DEFAULT_SPECIALIZATION)
    private int specializationBudget;

    @Option(
        names = "--sub-tree-budget",
        paramLabel = "POINTS",
        description = "Points the sub-tree must spend (default: ${DEFAULT-VALUE})",
        defaultValue = "" + SectionBudgets.DEFAULT_SUB_TREE)
    private int subTreeBudget;

    private NodeCatalog catalog;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Builds the command hierarchy. Unmatched options are taken as positional
     * parameters so that {@code -Name} directives reach {@code modify}.
     */
    static CommandLine commandLine() {
        return new CommandLine(new LoadoutCli()).setUnmatchedOptionsArePositionalParams(true);
    }

    NodeCatalog catalog() {
        if (catalog != null) {
            return catalog;
        }
        if (catalogFile == null) {
            throw new ParameterException(spec.commandLine(), "Missing required option: '--catalog=FILE'");
        }
        try {
            catalog = new JsonNodeCatalogReader().read(catalogFile);
        } catch (IOException | CatalogFormatException e) {
            throw new ParameterException(spec.commandLine(),
                "cannot load catalog '%s': %s".formatted(catalogFile, e.getMessage()), e, null, null);
        }
        log.debug("Loaded {} from {}", catalog, catalogFile);
        return catalog;
    }

    LoadoutValidator validator() {
        try {
            return new LoadoutValidator(SectionBudgets.builder()
                .withPrimary(primaryBudget)
                .withSpecialization(specializationBudget)
                .withSubTree(subTreeBudget)
                .build());
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }
    }

    /**
     * Decodes, or prints the decode failure and returns {@code null}.
     */
    DecodedLoadout decodeOrReport(String loadout, PrintWriter err) {
        try {
            return DECODER.decode(loadout, catalog());
        } catch (LoadoutDecodeException e) {
            err.println("Decode failed (" + e.reason() + "): " + e.getMessage());
            return null;
        }
    }

    static void printReport(ValidationReport report, PrintWriter out) {
        for (Section s : Section.values()) {
            out.println("  " + s.label() + ": " + report.pointsSpent(s) + " points");
        }
        out.println("  sub-tree group: " + report.subTree().orElse("none"));
        for (String error : report.errors()) {
            out.println("  ERROR: " + error);
        }
    }
}


@Command(
    name = "decode",
    description = "Prints the tree identity and the selected nodes of a loadout string")
class Decode implements Callable<Integer>
{
    @ParentCommand
    private LoadoutCli cli;

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "LOADOUT", description = "Loadout string")
    private String loadout;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DecodedLoadout decoded = cli.decodeOrReport(loadout, spec.commandLine().getErr());
        if (decoded == null) {
            return 1;
        }
        NodeCatalog catalog = cli.catalog();
        SelectionPartition partition = catalog.partition(decoded.selections());

        out.println("tree identity: " + decoded.treeIdentity());
        List<String> counts = new ArrayList<>();
        for (Section s : Section.values()) {
            counts.add(s.label() + " " + partition.section(s).size());
        }
        out.println("selected: " + String.join(", ", counts));
        out.println("sub-tree: " + partition.subTree().orElse("none"));

        for (Map.Entry<Integer, NodeSelection> e : decoded.selections().asMap().entrySet()) {
            TreeNode node = catalog.node(e.getKey()).orElseThrow();
            NodeSelection sel = e.getValue();
            StringBuilder line = new StringBuilder()
                .append("  ").append(node.id()).append(' ').append(node.displayName())
                .append(" (").append(sel.rank()).append('/').append(node.maxRank()).append(')');
            if (sel.choiceIndex().isPresent()) {
                int c = sel.choiceIndex().getAsInt();
                line.append(" [").append(c < node.entries().size() ? node.entries().get(c).name() : "#" + c).append(']');
            }
            out.println(line);
        }
        return 0;
    }
}


@Command(
    name = "encode",
    description = {
        "Encodes a name-keyed build into a loadout string",
        "",
        "Section parts are @|italic name[:rank]/name[:rank]/...|@ lists of node names;",
        "the sub-tree part names a whole sub-tree group.",
        "",
    })
class Encode implements Callable<Integer>
{
    @ParentCommand
    private LoadoutCli cli;

    @Spec
    private CommandSpec spec;

    @Option(names = "--tree", required = true, paramLabel = "ID", description = "Tree identity (0..65535)")
    private int treeIdentity;

    @Option(names = "--primary", paramLabel = "NODES", description = "Primary section nodes")
    private String primary;

    @Option(names = "--specialization", paramLabel = "NODES", description = "Specialization section nodes")
    private String specialization;

    @Option(names = "--sub-tree", paramLabel = "GROUP", description = "Sub-tree group taken in full")
    private String subTree;

    @Override
    public Integer call() {
        NodeCatalog catalog = cli.catalog();
        PrintWriter err = spec.commandLine().getErr();
        try {
            var selections = new OverrideResolver(catalog)
                .resolve(new LoadoutOverrides(primary, specialization, subTree));
            spec.commandLine().getOut().println(LoadoutCli.ENCODER.encode(treeIdentity, catalog, selections));
            return 0;
        } catch (UnknownNodeException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e, null, null);
        }
    }
}


@Command(
    name = "validate",
    description = "Checks a loadout string against section budgets and gates")
class Validate implements Callable<Integer>
{
    @ParentCommand
    private LoadoutCli cli;

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "LOADOUT", description = "Loadout string")
    private String loadout;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DecodedLoadout decoded = cli.decodeOrReport(loadout, spec.commandLine().getErr());
        if (decoded == null) {
            return 1;
        }
        ValidationReport report = cli.validator().validate(decoded, cli.catalog());
        out.println(report.valid() ? "VALID" : "INVALID");
        LoadoutCli.printReport(report, out);
        return report.valid() ? 0 : 1;
    }
}


@Command(
    name = "modify",
    description = {
        "Adds or removes nodes by name and re-encodes, if the result is valid",
        "",
        "  @|bold +Name|@       set to max rank",
        "  @|bold +Name:2|@     set to rank 2",
        "  @|bold -Name|@       remove",
        "",
        "Underscores in names read as spaces.",
        "",
    })
class Modify implements Callable<Integer>
{
    @ParentCommand
    private LoadoutCli cli;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "LOADOUT", description = "Base loadout string")
    private String loadout;

    @Parameters(index = "1..*", arity = "1..*", paramLabel = "DIRECTIVE", description = "+Name[:rank] or -Name")
    private List<String> directives;

    private final LoadoutObservabilitySink sink = new Slf4jLoadoutObservabilitySink();

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();

        List<LoadoutDirective> parsed = new ArrayList<>(directives.size());
        for (String d : directives) {
            try {
                parsed.add(LoadoutDirective.parse(d));
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage(), e, null, d);
            }
        }

        LoadoutModifier modifier = new LoadoutModifier(
            cli.catalog(), LoadoutCli.DECODER, LoadoutCli.ENCODER, cli.validator(), sink);

        final ModifyResult result;
        try {
            result = modifier.modify(loadout, parsed);
        } catch (LoadoutDecodeException e) {
            err.println("Decode failed (" + e.reason() + "): " + e.getMessage());
            return 1;
        } catch (UnknownNodeException e) {
            err.println(e.getMessage());
            return 1;
        }

        if (result instanceof ModifyResult.Accepted accepted) {
            spec.commandLine().getOut().println(accepted.loadout());
            return 0;
        }
        err.println("Build is INVALID, not encoded:");
        LoadoutCli.printReport(result.report(), err);
        return 1;
    }
}


@Command(
    name = "fingerprint",
    description = "Prints the specialization and sub-tree fingerprint of a loadout string")
class Fingerprint implements Callable<Integer>
{
    @ParentCommand
    private LoadoutCli cli;

    @Spec
    private CommandSpec spec;

    @Parameters(paramLabel = "LOADOUT", description = "Loadout string")
    private String loadout;

    @Override
    public Integer call() {
        DecodedLoadout decoded = cli.decodeOrReport(loadout, spec.commandLine().getErr());
        if (decoded == null) {
            return 1;
        }
        spec.commandLine().getOut().println(SelectionFingerprint.of(decoded.selections(), cli.catalog()));
        return 0;
    }
}
