package io.github.yok.photophys.in;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import io.github.yok.photophys.core.spectrum.SpectralSeries;
import io.github.yok.photophys.core.spectrum.SpectrumKind;
import java.nio.file.Paths;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;

public class CsvSpectrumRepositoryTest {

    private CsvSpectrumRepository repository;

    @Before
    public void setUp() throws Exception {
        String dir = Paths.get(getClass().getResource("/spectra").toURI()).toString();
        repository = new CsvSpectrumRepository(dir);
    }

    @Test
    public void testReadsAbsorptionInFileOrder() {
        // Act
        Optional<SpectralSeries> found = repository.findSpectrum("dye", SpectrumKind.ABSORPTION);

        // Assert
        assertTrue(found.isPresent());
        SpectralSeries s = found.get();
        assertEquals("dye", s.getCompoundId());
        assertEquals(SpectrumKind.ABSORPTION, s.getKind());
        assertEquals(31, s.size());
        assertEquals("descending file order is kept", 600.0, s.get(0).getWavelength(), 0.0);
        assertFalse(s.isStoredAscending());
        assertEquals(1.0, s.valueAt(450), 1e-9);
        assertEquals(0.0, s.get(15).getNormalized(), 0.0);
    }

    @Test
    public void testReadsEmissionIntoIntensity() {
        // Act
        SpectralSeries s = repository.findSpectrum("dye", SpectrumKind.EMISSION).get();

        // Assert
        assertEquals(22, s.size());
        assertEquals(440.0, s.get(0).getWavelength(), 0.0);
        assertEquals(0.0, s.get(0).getCoefficient(), 0.0);
        assertEquals(3.6e-05, s.get(0).getNormalized(), 0.0);
        assertEquals(1.0, s.maxValue(SpectrumKind.EMISSION), 1e-6);
    }

    @Test
    public void testMissingFileIsEmpty() {
        // Act / Assert
        assertFalse(repository.findSpectrum("unknown", SpectrumKind.ABSORPTION).isPresent());
        assertFalse("no dye emission for broken", repository
                .findSpectrum("broken", SpectrumKind.EMISSION).isPresent());
    }

    @Test(expected = IllegalStateException.class)
    public void testUnreadableNumberFails() {
        repository.findSpectrum("broken", SpectrumKind.ABSORPTION);
    }

    @Test
    public void testFileName() {
        assertEquals("dye_absorption.csv",
                CsvSpectrumRepository.fileName("dye", SpectrumKind.ABSORPTION));
        assertEquals("dye_emission.csv", CsvSpectrumRepository.fileName("dye", SpectrumKind.EMISSION));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsEmptyDirectory() {
        new CsvSpectrumRepository("");
    }
}
