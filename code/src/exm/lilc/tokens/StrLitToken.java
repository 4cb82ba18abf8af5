/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.lilc.tokens;

import com.google.common.base.Preconditions;

/**
 * String literal token.  The value is the literal as it appeared in
 * the source, with the surrounding quotes and escape sequences intact.
 */
public class StrLitToken extends Token {
  private final String value;

  public StrLitToken(String value, int line, int column) {
    super(line, column);
    this.value = Preconditions.checkNotNull(value);
  }

  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return "STRLIT(" + value + ")@" + position();
  }
}
