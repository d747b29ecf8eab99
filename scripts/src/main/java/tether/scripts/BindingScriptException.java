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
package tether.scripts;

import tether.ModuleLoadException;

/** Thrown when a binding script cannot be parsed or applied. */
public final class BindingScriptException extends ModuleLoadException {
  private static final long serialVersionUID = 1L;

  private final String source;
  private final int line;

  public BindingScriptException(String source, int line, String message) {
    super(source + ":" + line + ": " + message);
    this.source = source;
    this.line = line;
  }

  public BindingScriptException(String source, int line, String message, Throwable cause) {
    super(source + ":" + line + ": " + message, cause);
    this.source = source;
    this.line = line;
  }

  /** Returns the name of the script that failed. */
  public String source() {
    return source;
  }

  /** Returns the 1-based line that failed. */
  public int line() {
    return line;
  }
}
