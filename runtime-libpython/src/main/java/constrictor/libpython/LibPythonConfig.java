package constrictor.libpython;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/** How to find and start the embedded interpreter. */
public final class LibPythonConfig {

  /** System property naming the interpreter to embed. */
  public static final String EXECUTABLE_PROPERTY = "constrictor.python";

  /** Environment variable naming the interpreter to embed, if the property is not set. */
  public static final String EXECUTABLE_VARIABLE = "CONSTRICTOR_PYTHON";

  private final String executable;
  private final boolean initializeSignals;
  private final List<String> searchPaths;
  private final String programName;

  private LibPythonConfig(final Builder builder) {
    this.executable = builder.executable;
    this.initializeSignals = builder.initializeSignals;
    this.searchPaths = Collections.unmodifiableList(new ArrayList<>(builder.searchPaths));
    this.programName = builder.programName;
  }

  /** Configuration taken from the system properties and the environment. */
  public static LibPythonConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder(defaultExecutable(System.getProperties(), System.getenv()));
  }

  static String defaultExecutable(final Properties properties, final Map<String, String> env) {
    final String property = properties.getProperty(EXECUTABLE_PROPERTY);
    if (property != null && !property.trim().isEmpty()) {
      return property;
    }
    final String variable = env.get(EXECUTABLE_VARIABLE);
    if (variable != null && !variable.trim().isEmpty()) {
      return variable;
    }
    return "python3";
  }

  /** Interpreter executable used to locate the shared library. */
  public String executable() {
    return executable;
  }

  /** Whether Python installs its own signal handlers, e.g. for {@code SIGINT}. */
  public boolean initializeSignals() {
    return initializeSignals;
  }

  /** Extra entries for {@code sys.path}, searched right after the working directory. */
  public List<String> searchPaths() {
    return searchPaths;
  }

  /** Value of {@code Py_SetProgramName}, which {@code sys.prefix} is derived from. */
  public String programName() {
    return programName;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof LibPythonConfig)) {
      return false;
    }
    final LibPythonConfig that = (LibPythonConfig) obj;
    return initializeSignals == that.initializeSignals
        && executable.equals(that.executable)
        && searchPaths.equals(that.searchPaths)
        && programName.equals(that.programName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(executable, initializeSignals, searchPaths, programName);
  }

  @Override
  public String toString() {
    return String.format(
        "LibPythonConfig[executable=%s, initializeSignals=%b, searchPaths=%s, programName=%s]",
        executable, initializeSignals, searchPaths, programName);
  }

  public static final class Builder {

    private String executable;
    private boolean initializeSignals = false;
    private final List<String> searchPaths = new ArrayList<>();
    private String programName = "python";

    private Builder(final String executable) {
      this.executable = executable;
    }

    public Builder executable(final String executable) {
      this.executable = Objects.requireNonNull(executable);
      return this;
    }

    public Builder initializeSignals(final boolean initializeSignals) {
      this.initializeSignals = initializeSignals;
      return this;
    }

    public Builder searchPath(final String path) {
      searchPaths.add(Objects.requireNonNull(path));
      return this;
    }

    public Builder programName(final String programName) {
      this.programName = Objects.requireNonNull(programName);
      return this;
    }

    public LibPythonConfig build() {
      return new LibPythonConfig(this);
    }
  }
}
