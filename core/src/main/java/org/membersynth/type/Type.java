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

package org.membersynth.type;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.membersynth.binder.sym.DeclId;

/** Semantic types of declarations and synthesized signatures. */
public interface Type {

  /** A type kind. */
  enum TyKind {
    /** A tuple type; the empty tuple is the unit type of functions without a result. */
    TUPLE_TY,
    /** A reference to a nominal type declaration. */
    NOMINAL_TY,
    /** An optional wrapper around another type. */
    OPTIONAL_TY,
    /** A function type. */
    FUNCTION_TY,
    /** The type of an in/out parameter. */
    INOUT_TY,
    /** The metatype of another type. */
    METATYPE_TY,
    /** A compiler-builtin type with no declaration. */
    BUILTIN_TY,
    /** The abstract {@code Self} type of a protocol. */
    SELF_TY,

    ERROR_TY,
  }

  /** The type kind. */
  TyKind tyKind();

  /** An unrepresentable or invalid type. */
  Type ERROR =
      new Type() {
        @Override
        public TyKind tyKind() {
          return TyKind.ERROR_TY;
        }

        @Override
        public final String toString() {
          return "<error>";
        }
      };

  /** The unit type. */
  Type VOID = TupleTy.EMPTY;

  /** A tuple type. */
  @AutoValue
  abstract class TupleTy implements Type {

    public static final TupleTy EMPTY = create(ImmutableList.of());

    public static TupleTy create(ImmutableList<TupleElt> elements) {
      return new AutoValue_Type_TupleTy(elements);
    }

    /** Creates an unlabeled tuple type. */
    public static TupleTy of(Type... types) {
      ImmutableList.Builder<TupleElt> elements = ImmutableList.builder();
      for (Type type : types) {
        elements.add(TupleElt.create("", type));
      }
      return create(elements.build());
    }

    public abstract ImmutableList<TupleElt> elements();

    @Override
    public TyKind tyKind() {
      return TyKind.TUPLE_TY;
    }

    @Override
    public final String toString() {
      return "(" + Joiner.on(", ").join(elements()) + ")";
    }

    /** One possibly labeled element of a {@link TupleTy}. */
    @AutoValue
    public abstract static class TupleElt {

      public static TupleElt create(String label, Type type) {
        return new AutoValue_Type_TupleTy_TupleElt(label, type);
      }

      /** The element label, or the empty string. */
      public abstract String label();

      public abstract Type type();

      @Override
      public final String toString() {
        return label().isEmpty() ? type().toString() : label() + ": " + type();
      }
    }
  }

  /** A nominal type. */
  @AutoValue
  abstract class NominalTy implements Type {

    public static NominalTy create(DeclId decl, String name) {
      return new AutoValue_Type_NominalTy(decl, name);
    }

    /** The nominal type declaration. */
    public abstract DeclId decl();

    /** The simple name of the type. */
    public abstract String name();

    @Override
    public TyKind tyKind() {
      return TyKind.NOMINAL_TY;
    }

    @Override
    public final String toString() {
      return name();
    }

    @Memoized
    @Override
    public abstract int hashCode();
  }

  /** An optional type. */
  @AutoValue
  abstract class OptionalTy implements Type {

    public static OptionalTy create(Type wrapped) {
      return new AutoValue_Type_OptionalTy(wrapped);
    }

    /** The wrapped (non-optional) type. */
    public abstract Type wrapped();

    @Override
    public TyKind tyKind() {
      return TyKind.OPTIONAL_TY;
    }

    @Override
    public final String toString() {
      return wrapped() + "?";
    }
  }

  /** A function type. */
  @AutoValue
  abstract class FunctionTy implements Type {

    /** Function representations. */
    public enum Representation {
      /** A closure with a context. */
      THICK,
      /** A bare function pointer with no context. */
      THIN
    }

    public static FunctionTy create(
        Type input, Type result, Representation representation, boolean throwing) {
      return new AutoValue_Type_FunctionTy(input, result, representation, throwing);
    }

    public abstract Type input();

    public abstract Type result();

    public abstract Representation representation();

    public abstract boolean throwing();

    @Override
    public TyKind tyKind() {
      return TyKind.FUNCTION_TY;
    }

    @Override
    public final String toString() {
      StringBuilder sb = new StringBuilder();
      if (representation() == Representation.THIN) {
        sb.append("@thin ");
      }
      sb.append(input());
      if (throwing()) {
        sb.append(" throws");
      }
      sb.append(" -> ").append(result());
      return sb.toString();
    }
  }

  /** The type of an in/out parameter. */
  @AutoValue
  abstract class InOutTy implements Type {

    public static InOutTy create(Type object) {
      return new AutoValue_Type_InOutTy(object);
    }

    public abstract Type object();

    @Override
    public TyKind tyKind() {
      return TyKind.INOUT_TY;
    }

    @Override
    public final String toString() {
      return "inout " + object();
    }
  }

  /** A metatype. */
  @AutoValue
  abstract class MetatypeTy implements Type {

    public static MetatypeTy create(Type instance) {
      return new AutoValue_Type_MetatypeTy(instance);
    }

    public abstract Type instance();

    @Override
    public TyKind tyKind() {
      return TyKind.METATYPE_TY;
    }

    @Override
    public final String toString() {
      return instance() + ".Type";
    }
  }

  /** A builtin type. */
  @AutoValue
  abstract class BuiltinTy implements Type {

    /** Builtin type kinds. */
    public enum BuiltinKind {
      RAW_POINTER("RawPointer"),
      UNSAFE_VALUE_BUFFER("UnsafeValueBuffer"),
      INT("Int"),
      BOOL("Bool"),
      STRING("String");

      private final String name;

      BuiltinKind(String name) {
        this.name = name;
      }

      @Override
      public String toString() {
        return name;
      }
    }

    public static final BuiltinTy RAW_POINTER = create(BuiltinKind.RAW_POINTER);
    public static final BuiltinTy UNSAFE_VALUE_BUFFER = create(BuiltinKind.UNSAFE_VALUE_BUFFER);
    public static final BuiltinTy INT = create(BuiltinKind.INT);
    public static final BuiltinTy BOOL = create(BuiltinKind.BOOL);
    public static final BuiltinTy STRING = create(BuiltinKind.STRING);

    public static BuiltinTy create(BuiltinKind builtinKind) {
      return new AutoValue_Type_BuiltinTy(builtinKind);
    }

    public abstract BuiltinKind builtinKind();

    @Override
    public TyKind tyKind() {
      return TyKind.BUILTIN_TY;
    }

    @Override
    public final String toString() {
      return builtinKind().toString();
    }
  }

  /** The abstract {@code Self} type of a protocol. */
  @AutoValue
  abstract class SelfTy implements Type {

    public static SelfTy create(DeclId protocol) {
      return new AutoValue_Type_SelfTy(protocol);
    }

    /** The protocol declaring this {@code Self}. */
    public abstract DeclId protocol();

    @Override
    public TyKind tyKind() {
      return TyKind.SELF_TY;
    }

    @Override
    public final String toString() {
      return "Self";
    }
  }
}
