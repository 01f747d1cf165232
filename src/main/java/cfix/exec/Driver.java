package cfix.exec;

import cfix.analysis.AllocationAnalysis;
import cfix.analysis.AllocationAudit;
import cfix.analysis.AnalysisPass;
import cfix.hir.AllocatorLibrary;
import cfix.hir.PrintTools;
import cfix.hir.Tools;
import cfix.hir.TranslationUnit;
import cfix.hir.UnsupportedInput;
import cfix.transforms.ErrorCodeRefactoring;
import cfix.transforms.TransformPass;

import java.io.*;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Implements the command line parser and controls pass ordering.
 * Each input file is parsed, analyzed and rewritten on its own; the files
 * are handled one after another.
 */
public class Driver
{
  /** The name of the options file used by -dump-options and -load-options. */
  public static final String OPTIONS_FILE = "options.cfix";

  /**
   * A mapping from option names to option values.
   */
  protected static CommandLineOptionSet options = new CommandLineOptionSet();

  /** The filenames supplied on the command line, after expansion. */
  protected List<String> filenames;

  /** Number of files that could not be read, rewritten or written. */
  protected int failures;

  public Driver()
  {
    registerOptions();
  }

  /**
   * Register default legal set of options and default values for Driver.
   * Registering resets every value to its default.
   */
  public static void registerOptions()
  {
    options = new CommandLineOptionSet();
    options.add(options.ANALYSIS, "audit",
                "Report allocation results that are never checked, without rewriting anything");
    options.add(options.ANALYSIS, "callgraph",
                "Print the call graph of each file to stdout in graphviz format");
    options.add(options.UTILITY, "dump-options",
                "Create file " + OPTIONS_FILE + " with default options");
    options.add(options.UTILITY, "load-options",
                "Load options from file " + OPTIONS_FILE);
    options.add(options.UTILITY, "help",
                "Print this message");
    options.add(options.UTILITY, "in-place",
                "Overwrite the input files instead of writing to the output directory");
    options.add(options.UTILITY, "outdir", "cfix_output", "dirname",
                "Set the output directory name (default is cfix_output)");
    options.add(options.UTILITY, "verbosity", "0", "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
    options.add(options.UTILITY, "version",
                "Print the version information");
    options.add(options.TRANSFORM, "entry-point", "main", "name",
                "Name of the program entry point, whose signature is never changed (default is main)");
    options.add(options.TRANSFORM, "allocators", "name:style:check:arity,...",
        "Add allocating functions to the built-in table\n"
        + "      style is RETURN_PTR or ARG_PTR\n"
        + "      check is PTR_NULL, INT_NEGATIVE or INT_NONZERO\n"
        + "      arity may end in + for variadic functions");
  }

  /**
   * Returns the value of the given key or null
   * if the value is not set.  Key values are
   * set on the command line as <b>-option_name=value</b>.
   *
   * @param key The key to search
   * @return the value of the given key or null if the
   *   value is not set.
   */
  public static String getOptionValue(String key)
  {
    return options.getValue(key);
  }

  /**
   * Sets the value of the option represented by <i>key</i> to
   * <i>value</i>.
   *
   * @param key The option name.
   * @param value The option value.
   */
  public static void setOptionValue(String key, String value)
  {
    options.setValue(key, value);
  }

  /** Applies one line of an options file. */
  protected void parseOption(String opt)
  {
    opt = opt.trim();
    if (opt.length() < 2)
      return;
    int eq = opt.indexOf('=');
    if (eq == -1)
    {
      if (options.contains(opt))
        setOptionValue(opt, null);
      else
        System.err.println("ignoring unrecognized option " + opt);
    }
    else
    {
      String option_name = opt.substring(0, eq);
      if (options.contains(option_name))
        setOptionValue(option_name, opt.substring(eq + 1));
      else
        System.err.println("ignoring unrecognized option " + option_name);
    }
  }

  /**
   * Parses command line options to cfix.
   *
   * @param args The String array passed to main by the system.
   */
  protected void parseCommandLine(String[] args)
  {
    if (args.length == 0)
    {
      printUsage();
      Tools.exit(1);
    }

    int i; /* used after loop; don't put inside for loop */
    for (i = 0; i < args.length; ++i)
    {
      String opt = args[i];
      if (opt.length() < 2 || opt.charAt(0) != '-')
        break;

      int eq = opt.indexOf('=');
      String option_name = (eq == -1) ? opt.substring(1) : opt.substring(1, eq);
      if (options.contains(option_name))
        setOptionValue(option_name, (eq == -1) ? "1" : opt.substring(eq + 1));
      else
        System.err.println("ignoring unrecognized option " + option_name);

      if (getOptionValue("help") != null)
      {
        printUsage();
        Tools.exit(0);
      }

      if (getOptionValue("version") != null)
      {
        printVersion();
        Tools.exit(0);
      }

      if (getOptionValue("dump-options") != null)
      {
        setOptionValue("dump-options", null);
        dumpOptionsFile();
        Tools.exit(0);
      }

      // load options file and then proceed with rest
      // of command line options
      if (getOptionValue("load-options") != null)
      {
        setOptionValue("load-options", null);
        loadOptionsFile();
        // prevent reentering this handler
        setOptionValue("load-options", null);
      }
    }

    if (i >= args.length)
    {
      System.err.println("No input files!");
      Tools.exit(1);
    }

    filenames = new ArrayList<String>(args.length - i);
    for (; i < args.length; ++i)
    {
      File arg = new File(args[i]);
      if (args[i].contains("*") || args[i].contains("?"))
      {
        File parent = arg.getAbsoluteFile().getParentFile();
        File[] matches = parent.listFiles(new RegexFilter(arg.getName()));
        if (matches != null)
        {
          Arrays.sort(matches);
          for (File file : matches)
            addSources(file);
        }
      }
      else if (arg.isDirectory())
        addSources(arg);
      else
        filenames.add(args[i]);
    }
    if (filenames.isEmpty())
    {
      System.err.println("No input files!");
      Tools.exit(1);
    }
  }

  /** Adds a file, or every {@code .c} file below a directory. */
  private void addSources(File file)
  {
    if (!file.isDirectory())
    {
      filenames.add(file.getPath());
      return;
    }
    File[] children = file.listFiles();
    if (children == null)
      return;
    Arrays.sort(children);
    for (File child : children)
    {
      if (child.isDirectory() || child.getName().endsWith(".c"))
        addSources(child);
    }
  }

  /**
   * Prints the list of options that cfix accepts.
   */
  public void printUsage()
  {
    String usage = "\ncfix.exec.Driver [option]... [file|directory]...\n";
    usage += options.getUsage();
    System.err.println(usage);
  }

  /**
   * Dumps default options to file options.cfix in the working directory;
   * an existing file is not overwritten.
   */
  public void dumpOptionsFile()
  {
    File optionsFile = new File(OPTIONS_FILE);
    try {
      if (optionsFile.createNewFile())
      {
        PrintStream ps = new PrintStream(new FileOutputStream(optionsFile));
        try {
          ps.println(options.dumpOptions().trim());
        } finally {
          ps.close();
        }
      }
    } catch (IOException e) {
      System.err.println("Error: Failed to dump " + OPTIONS_FILE + ": " + e);
    }
  }

  /**
   * Loads options.cfix, searching the working directory and then the home
   * directory.
   */
  public void loadOptionsFile()
  {
    File optionsFile = new File(OPTIONS_FILE);
    if (!optionsFile.exists())
      optionsFile = new File(System.getProperty("user.home"), OPTIONS_FILE);
    if (!optionsFile.exists())
    {
      System.err.println("Error: Failed to load " + OPTIONS_FILE);
      System.err.println("Use option -dump-options to create " + OPTIONS_FILE
                         + " with default values");
      Tools.exit(1);
    }
    try {
      BufferedReader br = new BufferedReader(new FileReader(optionsFile));
      try {
        String line;
        while ((line = br.readLine()) != null)
        {
          if (line.startsWith("#"))
            continue;
          parseOption(line);
        }
      } finally {
        br.close();
      }
    } catch (IOException e) {
      System.err.println("Error while loading options file: " + e);
      Tools.exit(1);
    }
  }

  /**
   * Prints the compiler version.
   */
  public void printVersion()
  {
    System.err.println("cfix 1.0 - Allocation failure checks and error-code refactoring for C");
  }

  /**
   * Builds the allocator table from the built-in one and the
   * -allocators option.
   *
   * @throws UnsupportedInput if an entry is malformed.
   */
  public static AllocatorLibrary getAllocatorLibrary()
  {
    String value = getOptionValue("allocators");
    if (value == null || value.trim().isEmpty() || value.equals("1"))
      return AllocatorLibrary.getDefault();
    List<AllocatorLibrary.Entry> additions =
        new ArrayList<AllocatorLibrary.Entry>();
    for (String description : value.split(","))
    {
      if (!description.trim().isEmpty())
        additions.add(AllocatorLibrary.parseEntry(description));
    }
    return AllocatorLibrary.getDefault().extend(additions);
  }

  /**
   * Runs this driver with args as the command line.
   *
   * @param args The command line from main.
   * @return the exit status: 0, or 1 if any file failed.
   */
  public int run(String[] args)
  {
    parseCommandLine(args);

    AllocatorLibrary library = null;
    try {
      library = getAllocatorLibrary();
    } catch (UnsupportedInput e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }

    AllocationAudit audit = null;
    if (getOptionValue("audit") != null)
      audit = new AllocationAudit();

    Parser parser = new Parser();
    failures = 0;
    double timer = Tools.getTime();
    for (String filename : filenames)
    {
      TranslationUnit unit;
      try {
        unit = parser.parse(filename);
      } catch (IOException e) {
        PrintTools.printlnStatus(0, "could not read", filename + ":", e);
        failures++;
        continue;
      }
      runPasses(unit, library, audit);
      if (audit == null)
        writeUnit(unit);
    }
    if (audit != null)
      audit.print(System.out);
    PrintTools.printlnStatus(1, "Processed", filenames.size(), "files in",
        String.format("%.2f", Tools.getTime(timer)), "seconds");
    return (failures == 0) ? 0 : 1;
  }

  /**
   * Runs analysis and transformation passes on one unit.
   *
   * @param unit the parsed unit.
   * @param library the allocator table.
   * @param audit the audit to add to, or null to rewrite the unit.
   */
  public void runPasses(TranslationUnit unit, AllocatorLibrary library,
      AllocationAudit audit)
  {
    String entry_name = getOptionValue("entry-point");
    if (entry_name == null)
      entry_name = "main";

    if (audit != null)
    {
      AllocationAnalysis analysis = new AllocationAnalysis(unit, library);
      AnalysisPass.run(analysis);
      audit.add(unit, analysis);
      return;
    }

    ErrorCodeRefactoring pass =
        new ErrorCodeRefactoring(unit, library, entry_name);
    TransformPass.run(pass);

    if (getOptionValue("callgraph") != null)
      pass.getCallGraph().print(System.out);
  }

  private void writeUnit(TranslationUnit unit)
  {
    PrintTools.printlnStatus(1, "Printing", unit.getInputFilename());
    try {
      if (getOptionValue("in-place") != null)
      {
        if (unit.isModified())
          unit.printInPlace();
      }
      else
      {
        String outdir = getOptionValue("outdir");
        unit.print(new File((outdir == null) ? "cfix_output" : outdir));
      }
    } catch (IOException e) {
      PrintTools.printlnStatus(0, "could not write", unit.getInputFilename()
          + ":", e);
      failures++;
    }
  }

  /**
   * Entry point for cfix; creates a new Driver object,
   * and calls run on it with args.
   *
   * @param args Command line options.
   */
  public static void main(String[] args)
  {
    Tools.exit((new Driver()).run(args));
  }

  /**
  * Implementation of file filter for handling wild card character and other
  * special characters to generate regular expressions out of a string.
  */
  private static class RegexFilter implements FileFilter
  {
    /** Regular expression */
    private String regex;

    /** Constructs a new filter with the given input string
     * @param str String to construct regular expression out of
     * */
    public RegexFilter(String str)
    {
      regex = str.replaceAll("\\.", "\\\\.") // . => \.
          .replaceAll("\\?", ".")            // ? => .
          .replaceAll("\\*", ".*");          // * => .*
    }

    @Override
    public boolean accept(File f)
    {
      return f.getName().matches(regex);
    }
  }
}
