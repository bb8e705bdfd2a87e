package io.mersel.services.xbrl.application.interfaces;

import io.mersel.services.xbrl.application.models.xbrl.XbrlInstance;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Bellek içi modeli XBRL 2.1 instance XML'ine serileştirir.
 */
public interface IXbrlGenerator {

    /**
     * @return Girintili UTF-8 XML baytları
     * @throws XbrlGenerationException serileştirme başarısız olursa
     */
    byte[] generate(XbrlInstance instance);

    /**
     * Belgeyi hedef dosyaya atomik olarak yazar: yarım kalmış dosya görünmez.
     *
     * @throws IOException yazma veya taşıma başarısız olursa
     */
    void write(XbrlInstance instance, Path target) throws IOException;
}
