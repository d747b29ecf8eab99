/*
 * Copyright (C) 2012 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tether;

import java.nio.file.Path;
import java.nio.file.Paths;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Options that control how a kernel loads modules and activates instances.
 * Instances are immutable; use {@link #builder()} to create one.
 */
public final class KernelSettings {
  private final Path moduleBaseDirectory;
  private final boolean injectNonPublic;
  private final boolean loadExtensions;
  private final boolean allowNullInjection;

  private KernelSettings(Builder builder) {
    this.moduleBaseDirectory = builder.moduleBaseDirectory;
    this.injectNonPublic = builder.injectNonPublic;
    this.loadExtensions = builder.loadExtensions;
    this.allowNullInjection = builder.allowNullInjection;
  }

  public static KernelSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The directory that {@code ~} stands for in module paths. Defaults to the working directory. */
  public Path moduleBaseDirectory() {
    return moduleBaseDirectory;
  }

  /** True if private constructors and fields may be injected. */
  public boolean injectNonPublic() {
    return injectNonPublic;
  }

  /** True if module loader plugins are discovered with {@link java.util.ServiceLoader}. */
  public boolean loadExtensions() {
    return loadExtensions;
  }

  /** True if unresolvable dependencies and null-producing bindings inject null. */
  public boolean allowNullInjection() {
    return allowNullInjection;
  }

  public Builder toBuilder() {
    return new Builder()
        .moduleBaseDirectory(moduleBaseDirectory)
        .injectNonPublic(injectNonPublic)
        .loadExtensions(loadExtensions)
        .allowNullInjection(allowNullInjection);
  }

  @Override public String toString() {
    return "KernelSettings{moduleBaseDirectory=" + moduleBaseDirectory
        + ", injectNonPublic=" + injectNonPublic
        + ", loadExtensions=" + loadExtensions
        + ", allowNullInjection=" + allowNullInjection + "}";
  }

  public static final class Builder {
    private Path moduleBaseDirectory = Paths.get(System.getProperty("user.dir"));
    private boolean injectNonPublic = false;
    private boolean loadExtensions = true;
    private boolean allowNullInjection = false;

    private Builder() {
    }

    public Builder moduleBaseDirectory(Path moduleBaseDirectory) {
      this.moduleBaseDirectory = checkNotNull(moduleBaseDirectory, "moduleBaseDirectory");
      return this;
    }

    public Builder injectNonPublic(boolean injectNonPublic) {
      this.injectNonPublic = injectNonPublic;
      return this;
    }

    public Builder loadExtensions(boolean loadExtensions) {
      this.loadExtensions = loadExtensions;
      return this;
    }

    public Builder allowNullInjection(boolean allowNullInjection) {
      this.allowNullInjection = allowNullInjection;
      return this;
    }

    public KernelSettings build() {
      return new KernelSettings(this);
    }
  }
}
