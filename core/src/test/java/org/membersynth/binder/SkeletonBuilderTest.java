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

package org.membersynth.binder;

import static com.google.common.truth.Truth.assertThat;

import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.decl.ParamDecl;
import org.membersynth.decl.SubscriptDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.model.Accessibility;
import org.membersynth.model.AccessorKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.type.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SkeletonBuilderTest {

  private final SynthFixture fixture = new SynthFixture();
  private final SkeletonBuilder skeleton = new SkeletonBuilder(fixture.ctx);

  private ParamDecl param(FuncDecl fn, int index) {
    return fixture.arena.get(fn.params().get(index), ParamDecl.class);
  }

  private ParamDecl self(FuncDecl fn) {
    return fixture.arena.get(fn.selfParam(), ParamDecl.class);
  }

  @Test
  public void subscriptGetterClonesIndices() {
    NominalTypeDecl s = fixture.struct("S");
    ParamDecl i = fixture.param("", "i", Type.BuiltinTy.INT);
    ParamDecl j = fixture.param("at", "j", Type.BuiltinTy.STRING);
    SubscriptDecl subscript = fixture.subscript(s, Type.BuiltinTy.BOOL, i, j);

    FuncDecl getter = skeleton.createGetterPrototype(subscript);

    assertThat(getter.name()).isEqualTo("get:subscript");
    assertThat(getter.accessorKind()).isEqualTo(AccessorKind.GETTER);
    assertThat(getter.storage()).isEqualTo(subscript.id());
    assertThat(getter.resultType()).isEqualTo(Type.BuiltinTy.BOOL);
    assertThat(getter.params()).hasSize(2);
    assertThat(getter.params()).containsNoneOf(i.id(), j.id());
    assertThat(param(getter, 1).argumentName()).isEqualTo("at");
    assertThat(param(getter, 1).name()).isEqualTo("j");
    assertThat(param(getter, 1).isImplicit()).isTrue();
    assertThat(param(getter, 1).parent()).isEqualTo(getter.id());
    assertThat(getter.isMutating()).isFalse();
    assertThat(getter.isImplicit()).isTrue();
  }

  @Test
  public void setterTakesValueBeforeIndices() {
    NominalTypeDecl s = fixture.struct("S");
    SubscriptDecl subscript =
        fixture.subscript(s, Type.BuiltinTy.BOOL, fixture.param("", "i", Type.BuiltinTy.INT));

    FuncDecl setter = skeleton.createSetterPrototype(subscript);

    assertThat(setter.name()).isEqualTo("set:subscript");
    assertThat(setter.resultType()).isEqualTo(Type.VOID);
    assertThat(param(setter, 0).name()).isEqualTo("value");
    assertThat(param(setter, 0).type()).isEqualTo(Type.BuiltinTy.BOOL);
    assertThat(param(setter, 0).hasFlag(SynthFlag.ACC_LET)).isTrue();
    assertThat(param(setter, 1).name()).isEqualTo("i");
    assertThat(setter.isMutating()).isTrue();
    assertThat(self(setter).type()).isEqualTo(Type.InOutTy.create(s.declaredType()));
  }

  @Test
  public void nonmutatingSetter() {
    NominalTypeDecl s = fixture.struct("S");
    VarDecl x = fixture.var(s, "x", Type.BuiltinTy.INT);
    x.addFlags(SynthFlag.ACC_SETTER_NONMUTATING);

    FuncDecl setter = skeleton.createSetterPrototype(x);

    assertThat(setter.isMutating()).isFalse();
    assertThat(self(setter).type()).isEqualTo(s.declaredType());
  }

  @Test
  public void classSelfIsNeverInOut() {
    NominalTypeDecl c = fixture.classDecl("C");
    VarDecl x = fixture.var(c, "x", Type.BuiltinTy.INT);

    FuncDecl setter = skeleton.createSetterPrototype(x);

    assertThat(self(setter).type()).isEqualTo(c.declaredType());
  }

  @Test
  public void staticAccessorsTakeMetatype() {
    NominalTypeDecl s = fixture.struct("S");
    VarDecl x = fixture.var(s, "x", Type.BuiltinTy.INT);
    x.addFlags(SynthFlag.ACC_STATIC | SynthFlag.ACC_FINAL);

    FuncDecl getter = skeleton.createGetterPrototype(x);

    assertThat(getter.isStatic()).isTrue();
    assertThat(getter.isFinal()).isTrue();
    assertThat(self(getter).type()).isEqualTo(Type.MetatypeTy.create(s.declaredType()));
  }

  @Test
  public void globalAccessorsHaveNoSelf() {
    VarDecl g = fixture.var(fixture.file, "g", Type.BuiltinTy.INT);

    FuncDecl getter = skeleton.createGetterPrototype(g);

    assertThat(getter.selfParam()).isNull();
    assertThat(getter.parent()).isEqualTo(fixture.file.id());
  }

  @Test
  public void accessorAccessibility() {
    NominalTypeDecl s = fixture.struct("S");
    VarDecl x = fixture.var(s, "x", Type.BuiltinTy.INT);
    x.setAccessibility(Accessibility.PUBLIC);
    x.setSetterAccessibility(Accessibility.PRIVATE);

    assertThat(skeleton.createGetterPrototype(x).accessibility())
        .isEqualTo(Accessibility.PUBLIC);
    assertThat(skeleton.createSetterPrototype(x).accessibility())
        .isEqualTo(Accessibility.PRIVATE);
  }

  @Test
  public void unrepresentableIndices() {
    NominalTypeDecl s = fixture.struct("S");
    SubscriptDecl erroneous =
        fixture.subscript(s, Type.BuiltinTy.INT, fixture.param("", "i", Type.ERROR));
    SubscriptDecl variadic =
        fixture.subscript(
            s, Type.BuiltinTy.INT, fixture.variadicParam("", "i", Type.BuiltinTy.INT));

    assertThat(skeleton.createGetterPrototype(erroneous)).isNull();
    assertThat(skeleton.createSetterPrototype(variadic)).isNull();
  }

  @Test
  public void materializeForSetSignature() {
    NominalTypeDecl s = fixture.struct("S");
    VarDecl x = fixture.var(s, "x", Type.BuiltinTy.INT);
    FuncDecl setter = skeleton.createSetterPrototype(x);

    FuncDecl mfs = skeleton.createMaterializeForSetPrototype(x, setter, /* mutating= */ true);

    assertThat(mfs.name()).isEqualTo("materializeForSet:x");
    assertThat(param(mfs, 0).type()).isEqualTo(Type.BuiltinTy.RAW_POINTER);
    assertThat(param(mfs, 1).type())
        .isEqualTo(Type.InOutTy.create(Type.BuiltinTy.UNSAFE_VALUE_BUFFER));
    assertThat(mfs.resultType().tyKind()).isEqualTo(Type.TyKind.TUPLE_TY);
    assertThat(mfs.isMutating()).isTrue();
  }

  @Test
  public void materializeForSetOfErroneousType() {
    NominalTypeDecl s = fixture.struct("S");
    s.setDeclaredType(Type.ERROR);
    VarDecl x = fixture.var(s, "x", Type.BuiltinTy.INT);
    FuncDecl setter = skeleton.createSetterPrototype(x);

    FuncDecl mfs = skeleton.createMaterializeForSetPrototype(x, setter, /* mutating= */ false);

    assertThat(mfs.resultType()).isEqualTo(Type.ERROR);
  }
}
