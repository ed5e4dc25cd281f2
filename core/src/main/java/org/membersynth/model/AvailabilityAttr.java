/*
 * Copyright 2026 The membersynth Authors. All Rights Reserved.
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
 * limitations under the License.
 */

package org.membersynth.model;

import com.google.auto.value.AutoValue;

/**
 * The earliest platform version a declaration may be used on.
 *
 * <p>Version {@code 0.0} means the declaration is always available.
 */
@AutoValue
public abstract class AvailabilityAttr {

  public static final AvailabilityAttr ALWAYS = introducedIn(0, 0);

  public static AvailabilityAttr introducedIn(int major, int minor) {
    return new AutoValue_AvailabilityAttr(major, minor);
  }

  public abstract int major();

  public abstract int minor();

  public boolean isAlways() {
    return major() == 0 && minor() == 0;
  }

  /** Returns the availability of something that requires both this and {@code other}. */
  public AvailabilityAttr intersect(AvailabilityAttr other) {
    return isNoWiderThan(other) ? this : other;
  }

  /** Returns true if this is introduced no earlier than {@code other}. */
  public boolean isNoWiderThan(AvailabilityAttr other) {
    if (major() != other.major()) {
      return major() > other.major();
    }
    return minor() >= other.minor();
  }

  @Override
  public final String toString() {
    return isAlways() ? "*" : major() + "." + minor();
  }
}
