package works.schematic.compiler;

/**
 * One compiled conversion step, turning a value of some field
 * from one representation into the other.
 */
@FunctionalInterface
public interface ValueConverter {
	/**
	 * @param value never {@link Unset#UNSET UNSET}
	 * @return the converted value, or {@link Unset#UNSET UNSET} to leave the target unset
	 */
	Object convert(Object value, ConversionContext ctx);

	ValueConverter IDENTITY = (value, ctx) -> value;
}
