package works.schematic.compiler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.schematic.exceptions.NoMatchingUnionVariantException;
import works.schematic.exceptions.SchemaDefinitionException;
import works.schematic.schema.ClassSchema;
import works.schematic.schema.FieldSchema;
import works.schematic.schema.TypeTag;
import works.schematic.serializer.Guard;
import works.schematic.serializer.GuardRegistry;

import static works.schematic.compiler.Unset.UNSET;

/**
 * Builds the converter for a union field.
 * <p>
 * Every candidate is paired with the guards its serializer registers for its type tag.
 * Guards are tried in order of ascending specificality, ties going to the candidate declared first;
 * the first that accepts the value picks the candidate whose converter then runs.
 * Loose guards get a second pass if the caller allows it.
 */
final class UnionResolver {
	private UnionResolver() { }

	private record Candidate(
		FieldSchema field,
		int index,
		double specificality,
		Guard guard,
		ValueConverter converter
	) { }

	private static final Comparator<Candidate> ORDER = Comparator
		.comparingDouble(Candidate::specificality)
		.thenComparingInt(Candidate::index);

	static ValueConverter resolve(FieldSchema field, CompilerState state) {
		GuardRegistry guards = state.serializer().guards(state.direction());
		List<Candidate> strict = new ArrayList<>();
		List<Candidate> loose = new ArrayList<>();
		List<String> discriminants = new ArrayList<>();
		List<FieldSchema> candidates = field.unionCandidates();
		for (int i = 0; i < candidates.size(); i++) {
			FieldSchema candidate = candidates.get(i);
			ValueConverter converter = state.converterFor(candidate);
			discriminants.add(describe(candidate));
			for (GuardRegistry.Entry entry : guards.entriesFor(candidate.type())) {
				Guard guard = entry.generator().generate(candidate, state);
				if (guard != null) {
					Candidate c = new Candidate(candidate, i, entry.specificality(), guard, converter);
					(entry.loose() ? loose : strict).add(c);
				}
			}
		}
		if (strict.isEmpty() && loose.isEmpty()) {
			throw new SchemaDefinitionException("Invalid field " + field.name() + ": no " + state.direction() + " guards in " + state.serializer().name() + " for any union candidate");
		}
		strict.sort(ORDER);
		loose.sort(ORDER);
		LOGGER.debug("Union {} resolves via {}", field.name(), strict.stream().map(c -> c.field().type() + "@" + c.specificality()).toList());

		List<Candidate> strictCandidates = List.copyOf(strict);
		List<Candidate> looseCandidates = List.copyOf(loose);
		List<String> tried = List.copyOf(discriminants);
		return (value, ctx) -> {
			for (Candidate c : strictCandidates) {
				if (c.guard().test(value, ctx)) {
					return c.converter().convert(value, ctx);
				}
			}
			if (ctx.loosely()) {
				for (Candidate c : looseCandidates) {
					if (c.guard().test(value, ctx)) {
						LOGGER.trace("Loosely matched {} as {}", ctx.path(), c.field().type());
						return c.converter().convert(value, ctx);
					}
				}
			}
			if (field.optional()) {
				return UNSET;
			} else if (field.nullable()) {
				return null;
			} else if (field.hasDefault()) {
				return field.defaultValue();
			}
			throw new NoMatchingUnionVariantException(ctx.path(), field.name(), tried);
		};
	}

	private static String describe(FieldSchema candidate) {
		if (candidate.hasLiteral()) {
			return String.valueOf(candidate.literalValue());
		}
		if (TypeTag.CLASS.equals(candidate.type())) {
			ClassSchema schema = candidate.referencedSchema();
			FieldSchema discriminant = schema.discriminantField();
			if (discriminant != null) {
				return String.valueOf(discriminant.literalValue());
			}
			return schema.name();
		}
		return candidate.type().name();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(UnionResolver.class);
}
