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

import static com.google.common.collect.Iterables.getOnlyElement;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.tools.Diagnostic;
import org.membersynth.binder.SynthesisOutcome.Status;
import org.membersynth.binder.sym.DeclId;
import org.membersynth.decl.ConstructorDecl;
import org.membersynth.decl.DestructorDecl;
import org.membersynth.decl.FuncDecl;
import org.membersynth.decl.NominalTypeDecl;
import org.membersynth.decl.ParamDecl;
import org.membersynth.decl.VarDecl;
import org.membersynth.diag.SynthDiagnostic;
import org.membersynth.diag.SynthError;
import org.membersynth.diag.SynthError.ErrorKind;
import org.membersynth.model.Accessibility;
import org.membersynth.model.AvailabilityAttr;
import org.membersynth.model.DesignatedInitKind;
import org.membersynth.model.ImplicitConstructorKind;
import org.membersynth.model.NominalKind;
import org.membersynth.model.SynthFlag;
import org.membersynth.tree.AccessSemantics;
import org.membersynth.tree.Pretty;
import org.membersynth.tree.Tree;
import org.membersynth.type.Type;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ImplicitInitializersTest {

  private final SynthFixture fixture = new SynthFixture();

  private SynthesisOutcome implicitInit(NominalTypeDecl nominal) {
    return fixture
        .synthesizer()
        .synthesize(nominal.id(), SynthesisIntent.NEEDS_IMPLICIT_CONSTRUCTOR);
  }

  private SynthesisOutcome inherit(NominalTypeDecl classDecl, DesignatedInitKind kind) {
    return fixture
        .synthesizer()
        .synthesize(
            SynthesisRequest.builder()
                .setSubject(classDecl.id())
                .setIntent(SynthesisIntent.NEEDS_INHERITED_INITIALIZER)
                .setDesignatedInitKind(kind)
                .build());
  }

  private SynthesisOutcome destructor(NominalTypeDecl classDecl) {
    return fixture.synthesizer().synthesize(classDecl.id(), SynthesisIntent.NEEDS_DESTRUCTOR);
  }

  private ConstructorDecl onlyConstructor(SynthesisOutcome outcome) {
    assertThat(outcome.decls()).hasSize(1);
    return (ConstructorDecl) outcome.decls().get(0);
  }

  private ImmutableList<String> paramNames(ConstructorDecl ctor) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (DeclId param : ctor.params()) {
      names.add(fixture.arena.get(param, ParamDecl.class).name());
    }
    return names.build();
  }

  private ParamDecl param(ConstructorDecl ctor, int index) {
    return fixture.arena.get(ctor.params().get(index), ParamDecl.class);
  }

  @Test
  public void memberwiseInitializer() {
    NominalTypeDecl s = fixture.struct("S");
    fixture.var(s, "a", Type.BuiltinTy.INT);
    VarDecl b = fixture.let(s, "b", Type.BuiltinTy.INT);
    b.setInitializer(new Tree.IntLiteral(1, 1));
    fixture.let(s, "c", Type.BuiltinTy.STRING);
    fixture.var(s, "hidden", Type.BuiltinTy.INT).addFlags(SynthFlag.ACC_IMPLICIT);
    fixture.var(s, "shared", Type.BuiltinTy.INT).addFlags(SynthFlag.ACC_STATIC);
    VarDecl l = fixture.var(s, "l", Type.BuiltinTy.INT);
    l.addFlags(SynthFlag.ACC_LAZY);
    l.setInitializer(new Tree.IntLiteral(2, 2));

    SynthesisOutcome outcome = implicitInit(s);

    assertThat(outcome.status()).isEqualTo(Status.SYNTHESIZED);
    ConstructorDecl ctor = onlyConstructor(outcome);
    assertThat(s.members()).contains(ctor.id());
    assertThat(ctor.implicitKind()).isEqualTo(ImplicitConstructorKind.MEMBERWISE);
    assertThat(ctor.hasFlag(SynthFlag.ACC_MEMBERWISE)).isTrue();
    assertThat(ctor.isImplicit()).isTrue();
    assertThat(paramNames(ctor)).containsExactly("a", "c", "l").inOrder();
    assertThat(param(ctor, 0).argumentName()).isEqualTo("a");
    assertThat(param(ctor, 1).type()).isEqualTo(Type.BuiltinTy.STRING);
    assertThat(param(ctor, 2).type()).isEqualTo(Type.OptionalTy.create(Type.BuiltinTy.INT));
    assertThat(param(ctor, 2).hasFlag(SynthFlag.ACC_LET)).isTrue();
    assertThat(param(ctor, 2).parent()).isEqualTo(ctor.id());
    assertThat(Pretty.pretty(ctor.body()))
        .isEqualTo("{\n  self.a = a\n  self.c = c\n  self.l.storage = l\n}");
    assertThat(fixture.memberNames(s)).containsAtLeast("l", "l.storage").inOrder();
  }

  @Test
  public void memberwiseValueFillsLazyCache() {
    NominalTypeDecl s = fixture.struct("S");
    FuncDecl make = fixture.function("make", Type.BuiltinTy.INT);
    VarDecl v = fixture.var(s, "v", Type.BuiltinTy.INT);
    v.addFlags(SynthFlag.ACC_LAZY);
    v.setInitializer(
        new Tree.Call(
            1,
            new Tree.DeclRef(1, make.id(), "make", AccessSemantics.ORDINARY),
            Tree.TupleExpr.unlabeled(1, ImmutableList.of())));

    ConstructorDecl ctor = onlyConstructor(implicitInit(s));
    fixture.synthesizer().synthesize(v.id(), SynthesisIntent.LAZY);

    assertThat(fixture.memberNames(s))
        .containsExactly("v", "v.storage", "init", "get:v", "set:v")
        .inOrder();
    TreeEvaluator evaluator = new TreeEvaluator(fixture.arena);
    List<Object> made = new ArrayList<>();
    evaluator.functions.put(
        make.id(),
        args -> {
          made.add(42L);
          return 42L;
        });

    TreeEvaluator.Instance passed = evaluator.newInstance(s);
    evaluator.initialize(ctor, passed, 5L);
    assertThat(evaluator.call(fixture.getter(v), passed)).isEqualTo(5L);
    assertThat(made).isEmpty();

    TreeEvaluator.Instance omitted = evaluator.newInstance(s);
    evaluator.initialize(ctor, omitted, TreeEvaluator.NIL);
    assertThat(evaluator.call(fixture.getter(v), omitted)).isEqualTo(42L);
    assertThat(made).hasSize(1);
  }

  @Test
  public void memberwiseStoresThroughStorage() {
    NominalTypeDecl s = fixture.struct("S");
    VarDecl a = fixture.var(s, "a", Type.BuiltinTy.INT);

    ConstructorDecl ctor = onlyConstructor(implicitInit(s));

    Tree.Assign assign = (Tree.Assign) ctor.body().elements().get(0);
    Tree.MemberRef dest = (Tree.MemberRef) assign.dest();
    assertThat(dest.member()).isEqualTo(a.id());
    assertThat(dest.semantics()).isEqualTo(AccessSemantics.DIRECT_TO_STORAGE);
  }

  @Test
  public void memberwiseValidatesBeforeTypeChecking() {
    NominalTypeDecl s = fixture.struct("S");
    fixture.var(s, "a", Type.BuiltinTy.INT);
    fixture.var(s, "b", Type.BuiltinTy.INT);

    implicitInit(s);

    assertThat(fixture.resolver.events)
        .containsExactly("validate a", "validate b", "check1 init")
        .inOrder();
  }

  @Test
  public void memberwiseAccessIsNarrowestMember() {
    NominalTypeDecl s = fixture.struct("S");
    s.setAccessibility(Accessibility.PUBLIC);
    fixture.var(s, "a", Type.BuiltinTy.INT).setAccessibility(Accessibility.PUBLIC);
    fixture.var(s, "b", Type.BuiltinTy.INT).setAccessibility(Accessibility.PRIVATE);

    assertThat(onlyConstructor(implicitInit(s)).accessibility()).isEqualTo(Accessibility.PRIVATE);
  }

  @Test
  public void implicitInitializersAreAtMostInternal() {
    NominalTypeDecl s = fixture.struct("S");
    s.setAccessibility(Accessibility.PUBLIC);
    fixture.var(s, "a", Type.BuiltinTy.INT).setAccessibility(Accessibility.PUBLIC);

    assertThat(onlyConstructor(implicitInit(s)).accessibility())
        .isEqualTo(Accessibility.INTERNAL);
  }

  @Test
  public void foreignTypeKeepsItsAccessAndIsRegistered() {
    NominalTypeDecl s = fixture.struct("S");
    s.setAccessibility(Accessibility.PUBLIC);
    s.addFlags(SynthFlag.ACC_FOREIGN);

    ConstructorDecl ctor = onlyConstructor(implicitInit(s));

    assertThat(ctor.accessibility()).isEqualTo(Accessibility.PUBLIC);
    assertThat(fixture.ctx.externalDecls().decls()).containsExactly(ctor.id());
  }

  @Test
  public void defaultInitializer() {
    NominalTypeDecl base = fixture.classDecl("Base");
    NominalTypeDecl derived = fixture.subclass("Derived", base);

    ConstructorDecl baseInit = onlyConstructor(implicitInit(base));
    ConstructorDecl derivedInit = onlyConstructor(implicitInit(derived));

    assertThat(baseInit.implicitKind()).isEqualTo(ImplicitConstructorKind.DEFAULT);
    assertThat(baseInit.params()).isEmpty();
    assertThat(Pretty.pretty(baseInit.body())).isEqualTo("{\n}");
    assertThat(baseInit.hasFlag(SynthFlag.ACC_OVERRIDE)).isFalse();
    assertThat(derivedInit.hasFlag(SynthFlag.ACC_OVERRIDE)).isTrue();
  }

  @Test
  public void structDefaultInitializerOnRequest() {
    NominalTypeDecl s = fixture.struct("S");
    fixture.var(s, "a", Type.BuiltinTy.INT);

    SynthesisOutcome outcome =
        fixture
            .synthesizer()
            .synthesize(
                SynthesisRequest.builder()
                    .setSubject(s.id())
                    .setIntent(SynthesisIntent.NEEDS_IMPLICIT_CONSTRUCTOR)
                    .setConstructorKind(ImplicitConstructorKind.DEFAULT)
                    .build());

    ConstructorDecl ctor = onlyConstructor(outcome);
    assertThat(ctor.implicitKind()).isEqualTo(ImplicitConstructorKind.DEFAULT);
    assertThat(ctor.params()).isEmpty();
    assertThat(ctor.hasFlag(SynthFlag.ACC_MEMBERWISE)).isFalse();
  }

  @Test
  public void classesHaveNoMemberwiseInitializer() {
    NominalTypeDecl c = fixture.classDecl("C");
    SynthesisRequest request =
        SynthesisRequest.builder()
            .setSubject(c.id())
            .setIntent(SynthesisIntent.NEEDS_IMPLICIT_CONSTRUCTOR)
            .setConstructorKind(ImplicitConstructorKind.MEMBERWISE)
            .build();

    assertThrows(
        IllegalArgumentException.class, () -> fixture.synthesizer().synthesize(request));
  }

  @Test
  public void enumsAndProtocolsAreSkipped() {
    NominalTypeDecl e = fixture.type("E", NominalKind.ENUM);
    NominalTypeDecl p = fixture.protocol("P");

    assertThat(implicitInit(e).status()).isEqualTo(Status.SKIPPED);
    assertThat(implicitInit(p).status()).isEqualTo(Status.SKIPPED);
  }

  @Test
  public void secondImplicitInitializerRequest() {
    NominalTypeDecl s = fixture.struct("S");
    implicitInit(s);

    assertThat(implicitInit(s).status()).isEqualTo(Status.ALREADY_HANDLED);
    assertThat(fixture.memberNames(s)).containsExactly("init");
  }

  @Test
  public void reentrantImplicitInitializerRequest() {
    NominalTypeDecl s = fixture.struct("S");
    List<Status> nested = new ArrayList<>();
    fixture.resolver.onTypeCheck = decl -> nested.add(implicitInit(s).status());

    assertThat(implicitInit(s).status()).isEqualTo(Status.SYNTHESIZED);

    assertThat(nested).containsExactly(Status.ALREADY_HANDLED);
    assertThat(fixture.memberNames(s)).containsExactly("init");
  }

  @Test
  public void chainingOverride() {
    NominalTypeDecl base = fixture.classDecl("Base");
    ConstructorDecl superInit =
        fixture.designatedInit(base, fixture.param("x", "x", Type.BuiltinTy.INT));
    NominalTypeDecl d = fixture.subclass("D", base);

    SynthesisOutcome outcome = inherit(d, DesignatedInitKind.CHAINING);

    ConstructorDecl ctor = onlyConstructor(outcome);
    assertThat(d.members()).containsExactly(ctor.id());
    assertThat(Pretty.pretty(ctor.body())).isEqualTo("{\n  super.init(x: x)\n}");
    assertThat(ctor.overridden()).isEqualTo(superInit.id());
    assertThat(ctor.designatedKind()).isEqualTo(DesignatedInitKind.CHAINING);
    assertThat(ctor.hasFlag(SynthFlag.ACC_OVERRIDE)).isTrue();
    assertThat(ctor.isImplicit()).isTrue();
    assertThat(ctor.isThrowing()).isFalse();
    ParamDecl cloned = param(ctor, 0);
    assertThat(cloned.id()).isNotEqualTo(superInit.params().get(0));
    assertThat(cloned.hasFlag(SynthFlag.ACC_INHERITED)).isTrue();
    assertThat(cloned.parent()).isEqualTo(ctor.id());

    assertThat(inherit(d, DesignatedInitKind.CHAINING).status())
        .isEqualTo(Status.ALREADY_HANDLED);
    assertThat(d.members()).hasSize(1);
  }

  @Test
  public void throwingRequiredOverride() {
    NominalTypeDecl base = fixture.classDecl("Base");
    ConstructorDecl superInit =
        fixture.designatedInit(
            base,
            fixture.param("x", "x", Type.BuiltinTy.INT),
            fixture.param("", "y", Type.BuiltinTy.STRING));
    superInit.addFlags(SynthFlag.ACC_THROWS | SynthFlag.ACC_REQUIRED);
    NominalTypeDecl d = fixture.subclass("D", base);

    ConstructorDecl ctor = onlyConstructor(inherit(d, DesignatedInitKind.CHAINING));

    assertThat(Pretty.pretty(ctor.body())).isEqualTo("{\n  try super.init(x: x, y)\n}");
    assertThat(ctor.isThrowing()).isTrue();
    assertThat(ctor.isRequired()).isTrue();
  }

  @Test
  public void objcInitializerOverrideIsObjC() {
    NominalTypeDecl base = fixture.classDecl("Base");
    ConstructorDecl objcInit =
        fixture.designatedInit(base, fixture.param("x", "x", Type.BuiltinTy.INT));
    objcInit.addFlags(SynthFlag.ACC_OBJC);
    fixture.designatedInit(base, fixture.param("y", "y", Type.BuiltinTy.INT));
    NominalTypeDecl d = fixture.subclass("D", base);

    SynthesisOutcome outcome = inherit(d, DesignatedInitKind.CHAINING);

    assertThat(outcome.decls()).hasSize(2);
    ConstructorDecl first = (ConstructorDecl) outcome.decls().get(0);
    ConstructorDecl second = (ConstructorDecl) outcome.decls().get(1);
    assertThat(first.overridden()).isEqualTo(objcInit.id());
    assertThat(first.hasFlag(SynthFlag.ACC_OBJC)).isTrue();
    assertThat(second.hasFlag(SynthFlag.ACC_OBJC)).isFalse();
  }

  @Test
  public void overrideAccessAndAvailability() {
    NominalTypeDecl base = fixture.classDecl("Base");
    ConstructorDecl superInit = fixture.designatedInit(base);
    superInit.setAccessibility(Accessibility.PRIVATE);
    superInit.setAvailability(AvailabilityAttr.introducedIn(10, 2));
    NominalTypeDecl d = fixture.subclass("D", base);
    d.setAccessibility(Accessibility.PUBLIC);

    ConstructorDecl ctor = onlyConstructor(inherit(d, DesignatedInitKind.CHAINING));

    assertThat(ctor.accessibility()).isEqualTo(Accessibility.PRIVATE);
    assertThat(ctor.availability()).isEqualTo(AvailabilityAttr.introducedIn(10, 2));
  }

  @Test
  public void onlyTheRelatedInitializerIsOverridden() {
    NominalTypeDecl base = fixture.classDecl("Base");
    fixture.designatedInit(base);
    ConstructorDecl second =
        fixture.designatedInit(base, fixture.param("x", "x", Type.BuiltinTy.INT));
    NominalTypeDecl d = fixture.subclass("D", base);

    SynthesisOutcome outcome =
        fixture
            .synthesizer()
            .synthesize(
                SynthesisRequest.builder()
                    .setSubject(d.id())
                    .setIntent(SynthesisIntent.NEEDS_INHERITED_INITIALIZER)
                    .setRelated(second.id())
                    .build());

    assertThat(onlyConstructor(outcome).overridden()).isEqualTo(second.id());
    assertThat(inherit(d, DesignatedInitKind.CHAINING).decls()).hasSize(1);
    assertThat(d.members()).hasSize(2);
  }

  @Test
  public void stubOverride() {
    fixture.known.unimplementedInitializer =
        fixture.function("unimplementedInitializer", Type.VOID).id();
    NominalTypeDecl base = fixture.classDecl("Base");
    fixture.designatedInit(base, fixture.param("x", "x", Type.BuiltinTy.INT));
    NominalTypeDecl d = fixture.subclass("D", base);

    ConstructorDecl ctor = onlyConstructor(inherit(d, DesignatedInitKind.STUB));

    assertThat(Pretty.pretty(ctor.body()))
        .isEqualTo("{\n  unimplementedInitializer(\"Main.D\")\n}");
    assertThat(ctor.hasFlag(SynthFlag.ACC_STUB)).isTrue();
    assertThat(ctor.designatedKind()).isEqualTo(DesignatedInitKind.STUB);
    assertThat(fixture.ctx.log().diagnostics()).isEmpty();
  }

  @Test
  public void stubWithoutRuntimeSupport() {
    NominalTypeDecl base = fixture.classDecl("Base");
    fixture.designatedInit(base);
    NominalTypeDecl d = fixture.subclass("D", base);

    ConstructorDecl ctor = onlyConstructor(inherit(d, DesignatedInitKind.STUB));

    assertThat(ctor.body()).isNull();
    assertThat(ctor.hasFlag(SynthFlag.ACC_STUB)).isFalse();
    SynthDiagnostic diagnostic = getOnlyElement(fixture.ctx.log().diagnostics());
    assertThat(diagnostic.kind()).isEqualTo(ErrorKind.MISSING_UNIMPLEMENTED_INIT_RUNTIME);
    assertThat(diagnostic.decl()).isEqualTo(d.id());
    SynthError error = assertThrows(SynthError.class, () -> fixture.ctx.log().maybeThrow());
    assertThat(error).hasMessageThat().contains("missing runtime function");
  }

  @Test
  public void variadicSuperInitializerBecomesStub() {
    fixture.known.unimplementedInitializer =
        fixture.function("unimplementedInitializer", Type.VOID).id();
    NominalTypeDecl base = fixture.classDecl("Base");
    ConstructorDecl superInit =
        fixture.designatedInit(base, fixture.variadicParam("xs", "xs", Type.BuiltinTy.INT));
    NominalTypeDecl d = fixture.subclass("D", base);

    ConstructorDecl ctor = onlyConstructor(inherit(d, DesignatedInitKind.CHAINING));

    assertThat(ctor.designatedKind()).isEqualTo(DesignatedInitKind.STUB);
    assertThat(param(ctor, 0).isVariadic()).isTrue();
    ImmutableList<SynthDiagnostic> diagnostics = fixture.ctx.log().diagnostics();
    assertThat(diagnostics).hasSize(2);
    assertThat(diagnostics.get(0).kind())
        .isEqualTo(ErrorKind.UNSUPPORTED_SYNTHESIZE_INIT_VARIADIC);
    assertThat(diagnostics.get(0).severity()).isEqualTo(Diagnostic.Kind.ERROR);
    assertThat(diagnostics.get(0).decl()).isEqualTo(d.id());
    assertThat(diagnostics.get(0).message()).contains("subclass 'D'");
    assertThat(diagnostics.get(1).kind()).isEqualTo(ErrorKind.VARIADIC_SUPERCLASS_INIT_HERE);
    assertThat(diagnostics.get(1).severity()).isEqualTo(Diagnostic.Kind.NOTE);
    assertThat(diagnostics.get(1).decl()).isEqualTo(superInit.id());
  }

  @Test
  public void genericInitializersAreNotOverridden() {
    NominalTypeDecl base = fixture.classDecl("Base");
    fixture.designatedInit(base).addFlags(SynthFlag.ACC_GENERIC);
    NominalTypeDecl d = fixture.subclass("D", base);

    SynthesisOutcome outcome = inherit(d, DesignatedInitKind.CHAINING);

    assertThat(outcome.status()).isEqualTo(Status.NOT_SYNTHESIZED);
    assertThat(d.members()).isEmpty();
  }

  @Test
  public void rootClassInheritsNothing() {
    NominalTypeDecl c = fixture.classDecl("C");

    assertThat(inherit(c, DesignatedInitKind.CHAINING).status()).isEqualTo(Status.SKIPPED);
  }

  @Test
  public void implicitDestructor() {
    NominalTypeDecl c = fixture.classDecl("C");

    SynthesisOutcome outcome = destructor(c);

    assertThat(outcome.status()).isEqualTo(Status.SYNTHESIZED);
    DestructorDecl destructor = (DestructorDecl) outcome.decls().get(0);
    assertThat(fixture.memberNames(c)).containsExactly("deinit");
    assertThat(c.hasDestructor()).isTrue();
    assertThat(destructor.isImplicit()).isTrue();
    assertThat(Pretty.pretty(destructor.body())).isEqualTo("{\n}");
    assertThat(fixture.resolver.events).containsExactly("check1 deinit");

    assertThat(destructor(c).status())
        .isEqualTo(Status.ALREADY_HANDLED);
    assertThat(fixture.memberNames(c)).containsExactly("deinit");
  }

  @Test
  public void invalidClassGetsNoDestructor() {
    NominalTypeDecl c = fixture.classDecl("C");
    c.addFlags(SynthFlag.ACC_INVALID);

    ImplicitInitializers initializers = fixture.implicitInitializers();

    assertThat(initializers.addImplicitDestructor(c)).isNull();
    assertThat(destructor(c).status())
        .isEqualTo(Status.SKIPPED);
    assertThat(c.members()).isEmpty();
  }
}
