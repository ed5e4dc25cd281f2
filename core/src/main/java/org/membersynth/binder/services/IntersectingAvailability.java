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

package org.membersynth.binder.services;

import com.google.common.collect.ImmutableList;
import org.membersynth.decl.Decl;
import org.membersynth.model.AvailabilityAttr;

/** Infers availability as the latest introduction version among the dependencies. */
public class IntersectingAvailability implements AvailabilityInference {

  @Override
  public AvailabilityAttr inferredAvailability(Decl subject, ImmutableList<Decl> dependencies) {
    AvailabilityAttr result = AvailabilityAttr.ALWAYS;
    for (Decl dep : dependencies) {
      result = result.intersect(dep.availability());
    }
    return result;
  }
}
