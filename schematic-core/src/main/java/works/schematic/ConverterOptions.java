package works.schematic;

import java.util.List;
import java.util.Set;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ConverterOptions {
	public static final ConverterOptions DEFAULT = ConverterOptions.builder().build();

	/**
	 * Entities enclosing the value being decoded, outermost first.
	 * Fields marked as parent references are filled from these,
	 * followed by the entities being built around them.
	 */
	@Default List<Object> parents = List.of();

	/**
	 * When non-empty, only fields belonging to at least one of these groups are converted.
	 */
	@Default Set<String> groups = Set.of();

	/**
	 * Fields belonging to any of these groups are not converted.
	 */
	@Default Set<String> groupsExclude = Set.of();

	/**
	 * Whether union resolution, having found no candidate whose shape matches exactly,
	 * tries again with coercing checks, such as accepting {@code "12"} as a number.
	 */
	@Default boolean loosely = true;
}
