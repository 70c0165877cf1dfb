package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The pair of alleles carried at one gene. Construction puts the alleles in canonical order
 * (star alleles by number, then by label), so {@code *2/*1} and {@code *1/*2} are the same
 * diplotype.
 */
public final class Diplotype implements Serializable {

	private static final long serialVersionUID = -6150358711127834027L;

	private static final Pattern STAR_NUMBER = Pattern.compile("\\*(\\d{1,9})");

	public static final Comparator<String> ALLELE_ORDER = Diplotype::compareAlleleLabels;

	private final String gene;
	private final Allele first;
	private final Allele second;

	private Diplotype(String gene, Allele first, Allele second) {
		this.gene = gene;
		this.first = first;
		this.second = second;
	}

	public static Diplotype of(Allele allele1, Allele allele2) {
		if (!Objects.equals(allele1.getGene(), allele2.getGene())) {
			throw new IllegalArgumentException("Alleles " + allele1.getLabel() + " and " + allele2.getLabel()
					+ " belong to different genes: " + allele1.getGene() + ", " + allele2.getGene());
		}
		if (ALLELE_ORDER.compare(allele1.getLabel(), allele2.getLabel()) <= 0) {
			return new Diplotype(allele1.getGene(), allele1, allele2);
		}
		return new Diplotype(allele1.getGene(), allele2, allele1);
	}

	/**
	 * Splits a diplotype written as {@code allele/allele} into its two labels.
	 */
	public static String[] splitLabel(String diplotype) {
		String[] parts = diplotype == null ? new String[0] : diplotype.split("/");
		if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
			throw new IllegalArgumentException("Diplotype must be written as two alleles separated by '/': " + diplotype);
		}
		return new String[] {parts[0].trim(), parts[1].trim()};
	}

	public String getGene() {
		return gene;
	}

	public Allele getFirst() {
		return first;
	}

	public Allele getSecond() {
		return second;
	}

	public boolean isHomozygous() {
		return first.getLabel().equals(second.getLabel());
	}

	public String getLabel() {
		return first.getLabel() + "/" + second.getLabel();
	}

	/**
	 * @return the summed activity of both alleles, or null when either allele has unknown function
	 */
	public Double getActivityScore() {
		if (!first.hasKnownFunction() || !second.hasKnownFunction()) {
			return null;
		}
		return first.getActivity() + second.getActivity();
	}

	private static int compareAlleleLabels(String a, String b) {
		Matcher matcherA = STAR_NUMBER.matcher(a);
		Matcher matcherB = STAR_NUMBER.matcher(b);
		if (matcherA.lookingAt() && matcherB.lookingAt()) {
			int byNumber = Integer.compare(Integer.parseInt(matcherA.group(1)), Integer.parseInt(matcherB.group(1)));
			if (byNumber != 0) {
				return byNumber;
			}
		}
		return a.compareTo(b);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Diplotype that = (Diplotype) o;
		return gene.equals(that.gene) && first.getLabel().equals(that.first.getLabel())
				&& second.getLabel().equals(that.second.getLabel());
	}

	@Override
	public int hashCode() {
		return Objects.hash(gene, first.getLabel(), second.getLabel());
	}

	@Override
	public String toString() {
		return gene + " " + getLabel();
	}
}
