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
package tether.modules;

import com.google.common.collect.ImmutableList;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import tether.Module;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns files of a particular kind into modules. Each plugin declares the file
 * name patterns it supports, as globs like {@code *.jar}; the
 * {@link ModuleLoader} hands it the files whose names match.
 *
 * <p>Plugins are registered as kernel components. Their patterns may be
 * changed at any time to restrict which files later loads pick up.
 */
public abstract class ModuleLoaderPlugin {
  private volatile ImmutableList<String> supportedPatterns;
  private volatile ImmutableList<PathMatcher> matchers;

  protected ModuleLoaderPlugin(String... supportedPatterns) {
    setSupportedPatterns(supportedPatterns);
  }

  public List<String> getSupportedPatterns() {
    return supportedPatterns;
  }

  /** Replaces the file name patterns this plugin accepts. */
  public final void setSupportedPatterns(String... patterns) {
    checkNotNull(patterns, "patterns");
    ImmutableList.Builder<PathMatcher> builder = ImmutableList.builder();
    for (String pattern : patterns) {
      checkArgument(pattern != null && !pattern.isEmpty(), "Empty pattern");
      builder.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
    }
    this.matchers = builder.build();
    this.supportedPatterns = ImmutableList.copyOf(patterns);
  }

  /** Returns true if the name of {@code file} matches one of the supported patterns. */
  public boolean supports(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return false;
    }
    for (PathMatcher matcher : matchers) {
      if (matcher.matches(name)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the modules defined by {@code files}, none of which are loaded yet.
   *
   * @throws tether.ModuleLoadException if any file cannot be read or understood.
   */
  public abstract List<Module> loadModules(List<Path> files);

  @Override public String toString() {
    return getClass().getSimpleName() + supportedPatterns;
  }
}
